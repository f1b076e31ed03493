package com.proofline.core.model;

/**
 * Which identifier a model response uses to point at a task item.
 */
public enum IdentifierScheme {
    /** Source identifier, {@code task_item.remote_id}. */
    REMOTE_ID("remote_id"),
    /** Local identifier, {@code task_item.id_task_item}. */
    TASK_ITEM_ID("id_task_item");

    private final String column;

    IdentifierScheme(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public IdentifierScheme alternate() {
        return this == REMOTE_ID ? TASK_ITEM_ID : REMOTE_ID;
    }
}
