package com.example.leads.store;

public enum ChangeType {
    INSERT,
    UPDATE,
    DELETE
}
