package com.buildnotify.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildsetRecord {

    private Long bsid;
    private String reason;
    @Builder.Default
    private List<SourceStamp> sourcestamps = new ArrayList<>();
}
