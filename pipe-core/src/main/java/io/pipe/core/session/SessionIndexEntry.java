package io.pipe.core.session;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionIndexEntry(
    @JsonProperty("created_at") OffsetDateTime createdAt,
    @JsonProperty("last_updated_at") @JsonAlias("last_updated") OffsetDateTime lastUpdatedAt,
    String purpose
) {

    public SessionIndexEntry touched(OffsetDateTime now, String newPurpose) {
        return new SessionIndexEntry(createdAt, now, newPurpose != null ? newPurpose : purpose);
    }
}
