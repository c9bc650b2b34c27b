package com.qubicescrow.verification.service;

import com.qubicescrow.verification.domain.PostData;
import com.qubicescrow.verification.exception.InvalidPostDataException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Rejects post data with missing or malformed required fields before any analysis runs
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PostDataValidator {

    private final Validator validator;

    public void validate(PostData postData) {
        if (postData == null) {
            throw new InvalidPostDataException(List.of("postData: must not be null"));
        }

        Set<ConstraintViolation<PostData>> violations = validator.validate(postData);
        List<String> messages = new ArrayList<>();
        violations.forEach(v -> messages.add(v.getPropertyPath() + ": " + v.getMessage()));
        // Bean validation lets +Infinity through @PositiveOrZero
        if (Double.isInfinite(postData.getHistoricalAvgEngagement())) {
            messages.add("historicalAvgEngagement: must be finite");
        }
        if (!messages.isEmpty()) {
            Collections.sort(messages);
            log.warn("POST_DATA_REJECTED | postUrl={} | violations={}", postData.getPostUrl(), messages);
            throw new InvalidPostDataException(messages);
        }
    }
}
