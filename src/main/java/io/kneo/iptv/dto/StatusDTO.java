package io.kneo.iptv.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.kneo.iptv.model.cnst.FeedState;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Setter
@Getter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusDTO {
    private String status;
    private int channels;
    private int categories;
    private int epgChannels;
    private int favorites;
    private FeedState playlistState;
    private FeedState guideState;
    private Instant playlistLoadedAt;
    private Instant guideLoadedAt;
    private String playlistError;
    private String guideError;
}
