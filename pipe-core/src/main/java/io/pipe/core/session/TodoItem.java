package io.pipe.core.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TodoItem(String title, String description, boolean checked) {
}
