package com.qubicescrow.verification.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Aggregate engagement on a post: counters plus the individual comments in posting order
 */
@Value
@Builder(toBuilder = true)
public class EngagementBundle {

    @PositiveOrZero
    int likes;

    @NotNull
    @Valid
    @Singular
    List<CommentRecord> comments;

    @PositiveOrZero
    int shares;

    @PositiveOrZero
    int saves;

    public int getCommentCount() {
        return comments.size();
    }

    public static EngagementBundle empty() {
        return EngagementBundle.builder().build();
    }
}
