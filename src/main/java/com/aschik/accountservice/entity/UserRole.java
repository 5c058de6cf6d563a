package com.aschik.accountservice.entity;

public enum UserRole {
    ROLE_USER,
    ROLE_ADMIN
}
