package com.wpanther.cgaca.entity;

public enum KeyStatus {
    ACTIVE,
    INACTIVE,
    ROTATED
}
