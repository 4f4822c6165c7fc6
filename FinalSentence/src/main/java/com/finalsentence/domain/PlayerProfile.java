package com.finalsentence.domain;

/** Persistent player identity, independent of any room. */
public record PlayerProfile(String id, String displayName) {}
