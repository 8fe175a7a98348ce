package com.dnobretech.leitorbackend.auth;

import java.time.Instant;

public record TokenClaims(ClaimsUser user, Instant expiresAt) {}
