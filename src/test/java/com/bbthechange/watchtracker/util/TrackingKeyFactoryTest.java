package com.bbthechange.watchtracker.util;

import com.bbthechange.watchtracker.exception.InvalidKeyException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackingKeyFactoryTest {

    @Test
    void keys_FollowSingleTablePattern() {
        assertThat(TrackingKeyFactory.getUserPk("user-1")).isEqualTo("USER#user-1");
        assertThat(TrackingKeyFactory.getShowTrackingSk(1399)).isEqualTo("TRACKING#SHOW#1399");
        assertThat(TrackingKeyFactory.getShowTrackingSkPrefix()).isEqualTo("TRACKING#SHOW#");
    }

    @Test
    void getUserPk_InvalidUserId_Throws() {
        assertThatThrownBy(() -> TrackingKeyFactory.getUserPk(null)).isInstanceOf(InvalidKeyException.class);
        assertThatThrownBy(() -> TrackingKeyFactory.getUserPk("  ")).isInstanceOf(InvalidKeyException.class);
        assertThatThrownBy(() -> TrackingKeyFactory.getUserPk("a#b")).isInstanceOf(InvalidKeyException.class);
    }

    @Test
    void getShowTrackingSk_NonPositiveShowId_Throws() {
        assertThatThrownBy(() -> TrackingKeyFactory.getShowTrackingSk(0)).isInstanceOf(InvalidKeyException.class);
        assertThatThrownBy(() -> TrackingKeyFactory.getShowTrackingSk(null)).isInstanceOf(InvalidKeyException.class);
    }

    @Test
    void parseShowId_RecoversIdOrEmpty() {
        assertThat(TrackingKeyFactory.parseShowId("TRACKING#SHOW#1399")).contains(1399);
        assertThat(TrackingKeyFactory.parseShowId("TRACKING#SHOW#abc")).isEmpty();
        assertThat(TrackingKeyFactory.parseShowId("TRACKING#SHOW#0")).isEmpty();
        assertThat(TrackingKeyFactory.parseShowId("METADATA")).isEmpty();
        assertThat(TrackingKeyFactory.parseShowId(null)).isEmpty();
    }
}
