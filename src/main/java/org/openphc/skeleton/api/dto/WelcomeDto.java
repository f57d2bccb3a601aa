package org.openphc.skeleton.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WelcomeDto {

    private String message;
    private String environment;
    private String timestamp;
    private String documentation;
}
