package com.fairwaytour.model;

public enum RegistrationMode {
    SOLO,
    LOOKING_FOR_GROUP,
    CREATE_GROUP
}
