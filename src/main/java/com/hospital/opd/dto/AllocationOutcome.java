package com.hospital.opd.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.hospital.opd.entity.AllocationMethod;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;

import java.util.List;
import java.util.Map;

/**
 * Result of an allocation request: exactly one of a placed token, a list of
 * alternative slots, or a rejection with an error code.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "outcome")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AllocationOutcome.Allocated.class, name = "ALLOCATED"),
        @JsonSubTypes.Type(value = AllocationOutcome.Alternatives.class, name = "ALTERNATIVES"),
        @JsonSubTypes.Type(value = AllocationOutcome.Rejected.class, name = "REJECTED")
})
public sealed interface AllocationOutcome
        permits AllocationOutcome.Allocated, AllocationOutcome.Alternatives, AllocationOutcome.Rejected {

    record Allocated(TokenView token, AllocationMethod allocationMethod, List<PreemptedToken> preemptedTokens)
            implements AllocationOutcome {

        public Allocated {
            preemptedTokens = preemptedTokens == null ? List.of() : List.copyOf(preemptedTokens);
        }
    }

    record Alternatives(SlotSummary requestedSlot, List<AlternativeSlot> alternatives,
                        RecommendedAction recommendedAction, List<String> suggestions)
            implements AllocationOutcome {

        public Alternatives {
            alternatives = List.copyOf(alternatives);
            suggestions = List.copyOf(suggestions);
        }
    }

    record Rejected(ErrorCode errorCode, String message, Map<String, Object> details, List<String> suggestions)
            implements AllocationOutcome {

        public Rejected {
            details = details == null ? Map.of() : details;
            suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        }

        public static Rejected of(AllocationException e) {
            return new Rejected(e.getCode(), e.getMessage(), e.getDetails(), e.getSuggestions());
        }
    }
}
