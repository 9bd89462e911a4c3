package io.kneo.iptv.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;

@Setter
@Getter
@NoArgsConstructor
public class PlaybackTargetDTO {
    private String title;
    private String originUrl;
    private String url;
    private boolean relayed;
    private Map<String, String> proxyHeaders;
}
