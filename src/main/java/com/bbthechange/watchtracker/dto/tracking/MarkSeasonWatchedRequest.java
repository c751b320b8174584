package com.bbthechange.watchtracker.dto.tracking;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarkSeasonWatchedRequest {

    @Size(max = 500, message = "Show name must be 500 characters or less")
    private String tvShowName;

    @Size(max = 500, message = "Poster path must be 500 characters or less")
    private String posterPath;
}
