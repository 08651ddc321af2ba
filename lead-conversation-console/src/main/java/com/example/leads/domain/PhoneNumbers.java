package com.example.leads.domain;

public final class PhoneNumbers {

    private PhoneNumbers() {}

    /**
     * Key on which leads, conversation sessions and agent sessions are correlated. The store matches
     * phones by exact value, so the key is the stored phone itself. A missing or blank phone
     * returns {@code null} and never takes part in a merge or a phone-keyed delete.
     */
    public static String correlationKey(String phone) {
        if (phone == null || phone.isBlank()) {
            return null;
        }
        return phone;
    }

    public static boolean correlates(String phone, String other) {
        String key = correlationKey(phone);
        return key != null && key.equals(correlationKey(other));
    }
}
