package com.ethnicthv.dyneq.demo.keyed;

public record NameKey(String key) implements Keyed<String> {
}
