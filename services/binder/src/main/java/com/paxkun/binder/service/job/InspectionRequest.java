package com.paxkun.binder.service.job;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /v1/merge/validate}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InspectionRequest {

    private List<String> sources;
    private List<String> formats;
}
