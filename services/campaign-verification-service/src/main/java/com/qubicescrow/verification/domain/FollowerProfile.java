package com.qubicescrow.verification.domain;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

/**
 * Snapshot of a single follower account as returned by the social platform
 */
@Value
@Builder(toBuilder = true)
public class FollowerProfile {

    @NotNull
    String username;

    @Getter(AccessLevel.NONE)
    boolean hasProfilePic;

    @PositiveOrZero
    int postCount;

    @PositiveOrZero
    int followingCount;

    @PositiveOrZero
    int followerCount;

    @PositiveOrZero
    int bioLength;

    @PositiveOrZero
    int accountAgeDays;

    boolean verified;

    @NotNull
    String location;

    public boolean hasProfilePic() {
        return hasProfilePic;
    }
}
