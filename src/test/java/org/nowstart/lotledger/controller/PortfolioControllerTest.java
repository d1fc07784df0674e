package org.nowstart.lotledger.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.lotledger.data.dto.HoldingDto;
import org.nowstart.lotledger.data.dto.ImportResultDto;
import org.nowstart.lotledger.data.dto.PortfolioSummaryDto;
import org.nowstart.lotledger.data.dto.PriceBackfillEntry;
import org.nowstart.lotledger.data.dto.PriceBackfillRequest;
import org.nowstart.lotledger.data.dto.PriceBackfillResultDto;
import org.nowstart.lotledger.data.dto.QuoteSyncResultDto;
import org.nowstart.lotledger.data.dto.RebuildResultDto;
import org.nowstart.lotledger.data.dto.TransactionPageDto;
import org.nowstart.lotledger.data.exception.LedgerApiException;
import org.nowstart.lotledger.data.type.EventKind;
import org.nowstart.lotledger.data.type.ValuationStatus;
import org.nowstart.lotledger.service.LedgerRebuildService;
import org.nowstart.lotledger.service.PortfolioQueryService;
import org.nowstart.lotledger.service.PriceBackfillService;
import org.nowstart.lotledger.service.QuoteSyncService;
import org.nowstart.lotledger.service.TransactionImportService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockMultipartFile;

@ExtendWith(MockitoExtension.class)
class PortfolioControllerTest {

    private static final ImportResultDto IMPORT_RESULT = new ImportResultDto(2, 0, 0, 0, List.of());

    @Mock
    private TransactionImportService transactionImportService;
    @Mock
    private PortfolioQueryService portfolioQueryService;
    @Mock
    private PriceBackfillService priceBackfillService;
    @Mock
    private QuoteSyncService quoteSyncService;
    @Mock
    private LedgerRebuildService ledgerRebuildService;

    @InjectMocks
    private PortfolioController controller;

    @Test
    void importFile_returnsCreatedWithImportResult() {
        byte[] content = "Date,Symbol,Type,Qty\n2024-01-15,NABIL,ON-CR,10\n".getBytes(StandardCharsets.UTF_8);
        when(transactionImportService.importCsv(content)).thenReturn(IMPORT_RESULT);

        ResponseEntity<ImportResultDto> response = controller.importFile(
                new MockMultipartFile("file", "export.csv", "text/csv", content));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody()).isEqualTo(IMPORT_RESULT);
    }

    @Test
    void importBody_encodesTextAsUtf8() {
        String body = "Date,Symbol,Type,Qty\n2024-01-15,NABIL,ON-CR,10\n";
        when(transactionImportService.importCsv(body.getBytes(StandardCharsets.UTF_8))).thenReturn(IMPORT_RESULT);

        ResponseEntity<ImportResultDto> response = controller.importBody(body);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody()).isEqualTo(IMPORT_RESULT);
    }

    @Test
    void importBody_rejectsBlankBody() {
        assertThatThrownBy(() -> controller.importBody("  "))
                .isInstanceOfSatisfying(LedgerApiException.class, exception -> {
                    assertThat(exception.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(exception.getCode()).isEqualTo("empty_import");
                });
        verify(transactionImportService, never()).importCsv(any());
    }

    @Test
    void getHoldings_delegatesToService() {
        List<HoldingDto> holdings = List.of(new HoldingDto(
                "API", 10L, new BigDecimal("1000.00"), new BigDecimal("100.00"), BigDecimal.ZERO, false,
                null, null, null, null, null, ValuationStatus.PRICE_UNAVAILABLE));
        when(portfolioQueryService.getHoldings(true)).thenReturn(holdings);

        assertThat(controller.getHoldings(true)).isEqualTo(holdings);
    }

    @Test
    void getSummary_delegatesToService() {
        PortfolioSummaryDto summary = new PortfolioSummaryDto(
                BigDecimal.TEN, BigDecimal.TEN, BigDecimal.ZERO, 0.0, BigDecimal.ZERO, 1, 1, 0, 0);
        when(portfolioQueryService.getSummary()).thenReturn(summary);

        assertThat(controller.getSummary()).isEqualTo(summary);
    }

    @Test
    void getTransactions_passesFiltersThrough() {
        TransactionPageDto page = new TransactionPageDto(List.of(), 1, 20, 0L, 0);
        LocalDate from = LocalDate.of(2025, 1, 1);
        when(portfolioQueryService.getTransactions("API", EventKind.SELL, from, null, 1, 20)).thenReturn(page);

        assertThat(controller.getTransactions("API", EventKind.SELL, from, null, 1, 20)).isEqualTo(page);
    }

    @Test
    void backfillPrices_delegatesToService() {
        PriceBackfillRequest request = new PriceBackfillRequest(List.of(
                new PriceBackfillEntry(5L, null, null, null, new BigDecimal("121"), null)));
        PriceBackfillResultDto result = new PriceBackfillResultDto(1, 0, 0, 0);
        when(priceBackfillService.backfill(request)).thenReturn(result);

        assertThat(controller.backfillPrices(request)).isEqualTo(result);
    }

    @Test
    void syncQuotesAndRebuild_delegateToServices() {
        QuoteSyncResultDto syncResult = new QuoteSyncResultDto(1, 1, 0, List.of());
        RebuildResultDto rebuildResult = new RebuildResultDto(3, 2, 2, 1, List.of());
        when(quoteSyncService.syncQuotes()).thenReturn(syncResult);
        when(ledgerRebuildService.rebuild()).thenReturn(rebuildResult);

        assertThat(controller.syncQuotes()).isEqualTo(syncResult);
        assertThat(controller.rebuild()).isEqualTo(rebuildResult);
    }
}
