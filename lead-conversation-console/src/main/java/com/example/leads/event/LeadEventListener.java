package com.example.leads.event;

public interface LeadEventListener {

    void onLifecycleEvent(LeadLifecycleEvent event);
}
