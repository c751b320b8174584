package com.bbthechange.watchtracker.service;

import com.bbthechange.watchtracker.dto.metadata.EpisodeMetadata;
import com.bbthechange.watchtracker.dto.metadata.SeasonMetadata;
import com.bbthechange.watchtracker.model.EpisodeKey;
import com.bbthechange.watchtracker.model.NextEpisode;
import com.bbthechange.watchtracker.model.ShowTracking;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Works out which episode a user should watch next.
 */
@Component
public class NextEpisodeResolver {

    private final Clock clock;

    @Autowired
    public NextEpisodeResolver(Clock clock) {
        this.clock = clock;
    }

    /**
     * The episode after {@code current}.
     *
     * Within the season this is the next aired episode, copied exactly. Past the
     * last aired episode it rolls over to episode 1 of the next regular season,
     * built from the season summary and marked approximate. Without
     * {@code allSeasons} rollover is skipped.
     *
     * @return empty when the user is caught up
     */
    public Optional<NextEpisode> computeNextEpisode(EpisodeKey current,
                                                    List<EpisodeMetadata> episodesInCurrentSeason,
                                                    List<SeasonMetadata> allSeasons) {
        LocalDate today = LocalDate.now(clock);
        List<EpisodeMetadata> aired = airedInOrder(episodesInCurrentSeason, today);

        for (int i = 0; i < aired.size(); i++) {
            if (aired.get(i).getEpisodeNumber() == current.getEpisode()) {
                if (i + 1 < aired.size()) {
                    EpisodeMetadata next = aired.get(i + 1);
                    return Optional.of(NextEpisode.exact(current.getSeason(), next.getEpisodeNumber(),
                            next.getName(), isoDate(next.getAirDate())));
                }
                break;
            }
        }

        if (allSeasons == null) {
            return Optional.empty();
        }

        return allSeasons.stream()
                .filter(season -> season.getSeasonNumber() != null)
                .filter(season -> season.getSeasonNumber() > current.getSeason() && season.getSeasonNumber() > 0)
                .min(Comparator.comparing(SeasonMetadata::getSeasonNumber))
                .map(season -> NextEpisode.approximate(season.getSeasonNumber(), 1,
                        seasonName(season) + " Episode 1", isoDate(season.getAirDate())));
    }

    /**
     * First aired episode the user has not watched, walking regular seasons in
     * order. Only seasons with a loaded episode list are considered.
     */
    public Optional<NextEpisode> findFirstUnwatched(ShowTracking tracking, List<SeasonMetadata> seasons) {
        if (seasons == null) {
            return Optional.empty();
        }
        LocalDate today = LocalDate.now(clock);

        List<SeasonMetadata> ordered = seasons.stream()
                .filter(season -> !season.isSpecials() && season.hasEpisodes())
                .sorted(Comparator.comparing(SeasonMetadata::getSeasonNumber))
                .collect(Collectors.toList());

        for (SeasonMetadata season : ordered) {
            for (EpisodeMetadata episode : airedInOrder(season.getEpisodes(), today)) {
                EpisodeKey key = EpisodeKey.of(season.getSeasonNumber(), episode.getEpisodeNumber());
                if (!tracking.isWatched(key)) {
                    return Optional.of(NextEpisode.exact(key.getSeason(), key.getEpisode(),
                            episode.getName(), isoDate(episode.getAirDate())));
                }
            }
        }
        return Optional.empty();
    }

    private static List<EpisodeMetadata> airedInOrder(List<EpisodeMetadata> episodes, LocalDate today) {
        if (episodes == null) {
            return List.of();
        }
        return episodes.stream()
                .filter(episode -> episode.getEpisodeNumber() != null && episode.hasAiredBy(today))
                .sorted(Comparator.comparing(EpisodeMetadata::getEpisodeNumber))
                .collect(Collectors.toList());
    }

    private static String seasonName(SeasonMetadata season) {
        String name = season.getName();
        return name != null && !name.isBlank() ? name : "Season " + season.getSeasonNumber();
    }

    private static String isoDate(LocalDate date) {
        return date != null ? date.toString() : null;
    }
}
