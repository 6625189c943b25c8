package com.hospital.opd.dto;

import java.time.LocalTime;

/** Position of an active token in its slot's consultation order. */
public record QueueEntry(int position, TokenView token, LocalTime estimatedStart) {
}
