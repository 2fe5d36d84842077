package com.ethnicthv.dyneq.demo.payload;

public record Receipt(int id) implements SharedPayload, ReadOnlyPayload {
}
