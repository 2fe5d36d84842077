package com.ethnicthv.dyneq.demo.keyed;

public record StringKey(String key) implements Keyed<String> {
}
