package io.kneo.iptv.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.kneo.iptv.model.Programme;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Setter
@Getter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgrammeDTO {
    private String title;
    private String description;
    private String category;
    private Instant start;
    private Instant stop;

    public static ProgrammeDTO of(Programme programme) {
        ProgrammeDTO dto = new ProgrammeDTO();
        dto.setTitle(programme.title());
        dto.setDescription(programme.description());
        dto.setCategory(programme.category());
        dto.setStart(programme.start());
        dto.setStop(programme.stop());
        return dto;
    }
}
