package com.example.leads.store;

/**
 * Logical tables the engine reads, changes or deletes from.
 */
public enum RecordTable {
    LEADS("sales", "leads", true),
    CONVERSATION_SESSIONS("agents", "conversation_sessions", true),
    CONVERSATION_MESSAGES("agents", "conversation_messages", false),
    // outside the organization boundary: rows carry no organization id
    AGENT_SESSIONS("agents", "agent_sessions", false);

    private final String schema;
    private final String tableName;
    private final boolean organizationScoped;

    RecordTable(String schema, String tableName, boolean organizationScoped) {
        this.schema = schema;
        this.tableName = tableName;
        this.organizationScoped = organizationScoped;
    }

    public String getSchema() {
        return schema;
    }

    public String getTableName() {
        return tableName;
    }

    public boolean isOrganizationScoped() {
        return organizationScoped;
    }

    public String qualifiedName() {
        return schema + "." + tableName;
    }
}
