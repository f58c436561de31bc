package io.statestream.subscribe.state;

/**
 * Catalog operation that produced a change.
 */
public enum CatalogOp {
    REGISTER,
    DEREGISTER
}
