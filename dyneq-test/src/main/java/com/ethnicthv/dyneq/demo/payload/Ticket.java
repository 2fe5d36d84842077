package com.ethnicthv.dyneq.demo.payload;

public record Ticket(int id) implements SharedPayload, ReadOnlyPayload {
}
