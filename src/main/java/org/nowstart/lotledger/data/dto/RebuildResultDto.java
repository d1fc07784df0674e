package org.nowstart.lotledger.data.dto;

import java.util.List;

public record RebuildResultDto(
        int transactions,
        int symbols,
        int lots,
        int disposals,
        List<String> costPendingSymbols
) {
}
