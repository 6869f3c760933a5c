package com.open_banking_archiver.dto;

import java.util.List;

public record PruneResult(
        List<String> deletedRequisitionIds,
        List<String> clearedRequisitionIds
) {}
