package com.qubicescrow.verification.domain;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A comment left on the campaign post
 */
@Value
@Builder(toBuilder = true)
public class CommentRecord {

    @NotNull
    String text;

    @NotNull
    String username;

    @NotNull
    Instant timestamp;

    String location;

    /**
     * Commenter location, {@value PostData#UNKNOWN_LOCATION} when the platform did not report one
     */
    public String getLocation() {
        return location != null ? location : PostData.UNKNOWN_LOCATION;
    }
}
