package io.kneo.iptv.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Setter
@Getter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChannelMetaDTO {
    private String id;
    private String name;
    private String artworkUrl;
    private String category;
    private String description;
}
