package com.gatewayadmin.admin.model;

public enum Operation {
    CREATE,
    UPDATE,
    DELETE   // soft delete, enabled=false
}
