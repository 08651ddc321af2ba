package com.example.leads.service;

import com.example.leads.domain.ConversationSession;
import com.example.leads.domain.Lead;
import com.example.leads.domain.LeadFilters;
import com.example.leads.domain.MergedLeadView;
import com.example.leads.domain.PhoneNumbers;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class LeadMergeEngine {

    static final Comparator<MergedLeadView> BY_RECENT_ACTIVITY = Comparator.comparing(
            MergedLeadView::lastActivityAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    public List<MergedLeadView> merge(Collection<Lead> leads, Collection<ConversationSession> sessions, LeadFilters filters) {
        LeadFilters resolved = LeadFilters.orNone(filters);
        Map<String, ConversationSession> sessionsByPhone = indexFreshestByPhone(sessions);

        List<MergedLeadView> merged = new ArrayList<>();
        Set<String> leadPhones = new HashSet<>();
        for (Lead lead : leads) {
            String phone = PhoneNumbers.correlationKey(lead.getPhone());
            if (phone != null) {
                leadPhones.add(phone);
            }
            // two leads on one phone share the session
            merged.add(MergedLeadView.real(lead, phone != null ? sessionsByPhone.get(phone) : null));
        }

        if (!resolved.hasLeadPredicates()) {
            sessionsByPhone.forEach((phone, session) -> {
                if (!leadPhones.contains(phone)) {
                    merged.add(MergedLeadView.virtual(session));
                }
            });
        }

        merged.sort(BY_RECENT_ACTIVITY);
        return merged;
    }

    public List<MergedLeadView> applyViewFilters(List<MergedLeadView> views, LeadFilters filters) {
        LeadFilters resolved = LeadFilters.orNone(filters);
        if (!resolved.hasSearch() && resolved.getConversationStatus() == null) {
            return List.copyOf(views);
        }
        String query = resolved.hasSearch() ? resolved.getSearch().trim().toLowerCase(Locale.ROOT) : null;
        return views.stream()
                .filter(view -> query == null || matchesSearch(view, query))
                .filter(view -> resolved.getConversationStatus() == null
                        || resolved.getConversationStatus().matches(view.getSession()))
                .toList();
    }

    public List<MergedLeadView> mergeAndFilter(Collection<Lead> leads, Collection<ConversationSession> sessions, LeadFilters filters) {
        return applyViewFilters(merge(leads, sessions, filters), filters);
    }

    Map<String, ConversationSession> indexFreshestByPhone(Collection<ConversationSession> sessions) {
        Map<String, ConversationSession> byPhone = new LinkedHashMap<>();
        for (ConversationSession session : sessions) {
            String phone = PhoneNumbers.correlationKey(session.getPhone());
            if (phone == null) {
                continue;
            }
            byPhone.merge(phone, session, (current, candidate) -> isFresher(candidate, current) ? candidate : current);
        }
        return byPhone;
    }

    private static boolean isFresher(ConversationSession candidate, ConversationSession current) {
        if (candidate.getUpdatedAt() == null) {
            return false;
        }
        return current.getUpdatedAt() == null || candidate.getUpdatedAt().isAfter(current.getUpdatedAt());
    }

    private static boolean matchesSearch(MergedLeadView view, String query) {
        return contains(view.getPhone(), query)
                || contains(view.getContactName(), query)
                || contains(view.getCompanyName(), query);
    }

    private static boolean contains(String value, String query) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(query);
    }
}
