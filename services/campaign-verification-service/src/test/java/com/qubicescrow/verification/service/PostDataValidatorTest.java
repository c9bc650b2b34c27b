package com.qubicescrow.verification.service;

import com.qubicescrow.verification.domain.PostData;
import com.qubicescrow.verification.exception.InvalidPostDataException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Path;
import jakarta.validation.Validator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;

import static com.qubicescrow.verification.TestDataBuilder.NOW;
import static com.qubicescrow.verification.TestDataBuilder.emptyCampaign;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Post Data Validator Tests")
class PostDataValidatorTest {

    @Mock
    private Validator validator;

    @InjectMocks
    private PostDataValidator postDataValidator;

    @Test
    @DisplayName("Should accept post data without violations")
    void shouldAcceptValidPostData() {
        // Given
        PostData post = emptyCampaign(NOW);
        when(validator.validate(post)).thenReturn(Set.of());

        // When / Then
        assertThatCode(() -> postDataValidator.validate(post)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject null post data without calling the validator")
    void shouldRejectNullPostData() {
        assertThatThrownBy(() -> postDataValidator.validate(null))
                .isInstanceOf(InvalidPostDataException.class)
                .hasMessage("Invalid post data: postData: must not be null");

        verifyNoInteractions(validator);
    }

    @Test
    @DisplayName("Should report violations sorted by property path")
    void shouldReportSortedViolations() {
        // Given
        PostData post = emptyCampaign(NOW);
        ConstraintViolation<PostData> likes = violation("engagement.likes", "must be greater than or equal to 0");
        ConstraintViolation<PostData> followers = violation("followers[0].location", "must not be null");
        when(validator.validate(any(PostData.class))).thenReturn(Set.of(likes, followers));

        // When / Then
        assertThatThrownBy(() -> postDataValidator.validate(post))
                .isInstanceOf(InvalidPostDataException.class)
                .hasMessage("Invalid post data: engagement.likes: must be greater than or equal to 0; "
                        + "followers[0].location: must not be null");
    }

    @Test
    @DisplayName("Should reject an infinite historical average")
    void shouldRejectInfiniteHistoricalAverage() {
        // Given
        PostData post = emptyCampaign(NOW).toBuilder()
                .historicalAvgEngagement(Double.POSITIVE_INFINITY)
                .build();
        when(validator.validate(post)).thenReturn(Set.of());

        // When / Then
        assertThatThrownBy(() -> postDataValidator.validate(post))
                .isInstanceOfSatisfying(InvalidPostDataException.class, e ->
                        assertThat(e.getViolations()).containsExactly("historicalAvgEngagement: must be finite"));
    }

    @SuppressWarnings("unchecked")
    private static ConstraintViolation<PostData> violation(String path, String message) {
        ConstraintViolation<PostData> violation = mock(ConstraintViolation.class);
        Path propertyPath = mock(Path.class);
        when(propertyPath.toString()).thenReturn(path);
        when(violation.getPropertyPath()).thenReturn(propertyPath);
        when(violation.getMessage()).thenReturn(message);
        return violation;
    }
}
