package com.wpanther.cgaca.entity;

public enum ActorType {
    SYSTEM,
    ADMIN,
    AGENT,
    API
}
