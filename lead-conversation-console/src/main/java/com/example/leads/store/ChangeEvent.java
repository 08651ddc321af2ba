package com.example.leads.store;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * "Something changed" notification of a change feed. Consumers re-derive state from the store and
 * do not rely on the record id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeEvent implements Serializable {

    private RecordTable table;
    private String organizationId;
    private ChangeType type;
    private String recordId;
    private Instant occurredAt;
}
