package com.riskscan.connect.service;

/**
 * Stages of the login/callback flow. Transitions only move forward; SESSION_EXPIRED and
 * EXCHANGE_FAILED are terminal failures.
 */
public enum AuthorizationStage {
    IDLE,
    SESSION_CREATED,
    CODE_RECEIVED,
    TOKEN_EXCHANGE,
    TOKEN_REFRESH,
    PROFILE_FETCH,
    IDENTITY_UPSERTED,
    SESSION_EXPIRED,
    EXCHANGE_FAILED
}
