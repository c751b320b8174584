package com.bbthechange.watchtracker.model;

import com.bbthechange.watchtracker.util.TrackingKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-user, per-show tracking document for the WatchTrackerTable.
 *
 * Key Pattern: PK = USER#{userId}, SK = TRACKING#SHOW#{showId}
 * Episodes are keyed by "{seasonNumber}_{episodeNumber}".
 */
@DynamoDbBean
public class EpisodeTrackingItem extends BaseItem {

    private String userId;
    private Integer showId;
    private Map<String, WatchedEpisode> episodes;
    private EpisodeTrackingMetadata metadata;

    // Default constructor for DynamoDB
    public EpisodeTrackingItem() {
        super();
        setItemType(TrackingKeyFactory.EPISODE_TRACKING_ITEM_TYPE);
    }

    public EpisodeTrackingItem(String userId, Integer showId, EpisodeTrackingMetadata metadata) {
        super();
        setItemType(TrackingKeyFactory.EPISODE_TRACKING_ITEM_TYPE);
        this.userId = userId;
        this.showId = showId;
        this.episodes = new HashMap<>();
        this.metadata = metadata;

        setPk(TrackingKeyFactory.getUserPk(userId));
        setSk(TrackingKeyFactory.getShowTrackingSk(showId));
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Integer getShowId() {
        return showId;
    }

    public void setShowId(Integer showId) {
        this.showId = showId;
    }

    public Map<String, WatchedEpisode> getEpisodes() {
        return episodes;
    }

    public void setEpisodes(Map<String, WatchedEpisode> episodes) {
        this.episodes = episodes;
    }

    public EpisodeTrackingMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(EpisodeTrackingMetadata metadata) {
        this.metadata = metadata;
    }

    public void putEpisode(WatchedEpisode episode) {
        if (this.episodes == null) {
            this.episodes = new HashMap<>();
        }
        this.episodes.put(episode.toKey().toStoreKey(), episode);
        touch();
    }
}
