package com.rewind.core.manager;

/**
 * IDLE: nothing tracked since the last checkpoint, restore or fork.
 * ACCUMULATING: messages have been tracked since then.
 */
public enum ManagerState {
    IDLE,
    ACCUMULATING
}
