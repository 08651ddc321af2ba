package com.example.leads.service;

import com.example.leads.service.exception.ServiceException;

public interface MergeSessionListener {

    void onSnapshot(LeadViewSnapshot snapshot);

    void onCountdown(CountdownTick tick);

    void onError(ServiceException error);
}
