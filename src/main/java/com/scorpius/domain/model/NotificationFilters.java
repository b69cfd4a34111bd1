package com.scorpius.domain.model;

import com.scorpius.domain.enums.NotificationPriority;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class NotificationFilters {

    @Builder.Default
    NotificationPriority minPriority = NotificationPriority.LOW;

    /** Allow-list: when non-empty, a message must contain at least one of these. */
    @Singular
    List<String> keywords;

    /** A message containing any of these is dropped, even if it matches an allow-listed keyword. */
    @Singular
    List<String> excludeKeywords;
}
