package com.bbthechange.watchtracker.service;

import com.bbthechange.watchtracker.dto.metadata.EpisodeMetadata;
import com.bbthechange.watchtracker.dto.metadata.SeasonMetadata;
import com.bbthechange.watchtracker.dto.progress.SeasonProgress;
import com.bbthechange.watchtracker.dto.progress.ShowProgress;
import com.bbthechange.watchtracker.model.EpisodeKey;
import com.bbthechange.watchtracker.model.ShowTracking;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives season and show completion from watched keys and catalog seasons.
 *
 * Only aired episodes count toward the denominator, so a season that is still
 * airing reports progress against what can actually be watched. Season 0
 * (specials) is excluded from show totals. No I/O; "today" comes from the clock.
 */
@Component
public class ProgressAggregator {

    private final Clock clock;

    @Autowired
    public ProgressAggregator(Clock clock) {
        this.clock = clock;
    }

    public ShowProgress computeShowProgress(ShowTracking tracking, List<SeasonMetadata> seasons) {
        List<SeasonProgress> perSeason = new ArrayList<>();
        int watched = 0;
        int total = 0;
        int aired = 0;

        List<SeasonMetadata> regular = seasons == null ? List.of() : seasons.stream()
                .filter(season -> !season.isSpecials())
                .sorted(Comparator.comparing(SeasonMetadata::getSeasonNumber))
                .collect(Collectors.toList());

        for (SeasonMetadata season : regular) {
            SeasonProgress progress = computeSeasonProgress(tracking, season);
            perSeason.add(progress);
            watched += progress.getWatchedCount();
            total += progress.getTotalCount();
            aired += progress.getTotalAiredCount();
        }

        return ShowProgress.builder()
                .totalWatched(watched)
                .totalEpisodes(total)
                .totalAiredEpisodes(aired)
                .percentage(percentage(watched, aired))
                .seasonProgress(perSeason)
                .build();
    }

    public SeasonProgress computeSeasonProgress(ShowTracking tracking, SeasonMetadata season) {
        int seasonNumber = season.getSeasonNumber();
        LocalDate today = LocalDate.now(clock);

        int declared = season.getEpisodeCount() != null ? Math.max(0, season.getEpisodeCount()) : 0;
        int totalCount;
        int airedCount;
        int watchedCount;

        if (season.hasEpisodes()) {
            List<EpisodeMetadata> episodes = season.getEpisodes();
            totalCount = Math.max(declared, episodes.size());

            Set<Integer> airedNumbers = episodes.stream()
                    .filter(episode -> episode.hasAiredBy(today))
                    .map(EpisodeMetadata::getEpisodeNumber)
                    .collect(Collectors.toSet());
            airedCount = airedNumbers.size();
            watchedCount = (int) tracking.watchedKeys().stream()
                    .filter(key -> key.getSeason() == seasonNumber)
                    .map(EpisodeKey::getEpisode)
                    .filter(airedNumbers::contains)
                    .count();
        } else {
            totalCount = declared;
            // No per-episode dates: a season that has premiered counts as fully aired
            boolean premiered = season.getAirDate() == null || !season.getAirDate().isAfter(today);
            airedCount = premiered ? totalCount : 0;
            watchedCount = tracking.watchedCountInSeason(seasonNumber);
        }

        watchedCount = Math.min(watchedCount, airedCount);

        return SeasonProgress.builder()
                .seasonNumber(seasonNumber)
                .watchedCount(watchedCount)
                .totalCount(totalCount)
                .totalAiredCount(airedCount)
                .percentage(percentage(watchedCount, airedCount))
                .build();
    }

    /**
     * round(watched / aired * 100), clamped to [0, 100]; 0 when nothing has aired.
     */
    public static int percentage(int watched, int aired) {
        if (aired <= 0) {
            return 0;
        }
        long rounded = Math.round(watched * 100.0 / aired);
        return (int) Math.max(0, Math.min(100, rounded));
    }
}
