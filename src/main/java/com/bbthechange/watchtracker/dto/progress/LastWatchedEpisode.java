package com.bbthechange.watchtracker.dto.progress;

import com.bbthechange.watchtracker.model.EpisodeKey;
import com.bbthechange.watchtracker.model.WatchedEpisode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LastWatchedEpisode {

    private int season;
    private int episode;
    private String name;
    private Long watchedAt;

    public static LastWatchedEpisode from(EpisodeKey key, WatchedEpisode watched) {
        return LastWatchedEpisode.builder()
                .season(key.getSeason())
                .episode(key.getEpisode())
                .name(watched.getEpisodeName())
                .watchedAt(watched.getWatchedAt())
                .build();
    }
}
