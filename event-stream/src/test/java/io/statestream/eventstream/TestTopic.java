package io.statestream.eventstream;

enum TestTopic implements Topic {
    HEALTH,
    CATALOG,
    UNREGISTERED
}
