package com.open_banking_archiver.nordigen.dto;

import java.util.List;

/** GET /requisitions/ is paged; {@code next} is an absolute URL or null on the last page. */
public record NordigenRequisitionPage(
        int count,
        String next,
        String previous,
        List<NordigenRequisition> results
) {}
