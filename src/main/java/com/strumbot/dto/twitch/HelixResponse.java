package com.strumbot.dto.twitch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Envelope shared by Helix collection endpoints: {@code {"data": [...]}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HelixResponse<T> {

    private List<T> data = new ArrayList<>();

    /**
     * First element, or null when the result set is empty.
     */
    public T first() {
        return data == null || data.isEmpty() ? null : data.get(0);
    }
}
