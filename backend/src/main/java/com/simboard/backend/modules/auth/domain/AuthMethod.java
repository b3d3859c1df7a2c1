package com.simboard.backend.modules.auth.domain;

public enum AuthMethod {
    SESSION,
    API_TOKEN
}
