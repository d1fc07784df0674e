package org.nowstart.lotledger.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import org.nowstart.lotledger.data.dto.DisposalDto;
import org.nowstart.lotledger.data.dto.HoldingDto;
import org.nowstart.lotledger.data.dto.ImportResultDto;
import org.nowstart.lotledger.data.dto.LotDto;
import org.nowstart.lotledger.data.dto.PortfolioSummaryDto;
import org.nowstart.lotledger.data.dto.PriceBackfillRequest;
import org.nowstart.lotledger.data.dto.PriceBackfillResultDto;
import org.nowstart.lotledger.data.dto.QuoteSyncResultDto;
import org.nowstart.lotledger.data.dto.RebuildResultDto;
import org.nowstart.lotledger.data.dto.TransactionDto;
import org.nowstart.lotledger.data.dto.TransactionPageDto;
import org.nowstart.lotledger.data.exception.LedgerApiException;
import org.nowstart.lotledger.data.type.EventKind;
import org.nowstart.lotledger.service.LedgerRebuildService;
import org.nowstart.lotledger.service.PortfolioQueryService;
import org.nowstart.lotledger.service.PriceBackfillService;
import org.nowstart.lotledger.service.QuoteSyncService;
import org.nowstart.lotledger.service.TransactionImportService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/portfolio")
@Tag(name = "Portfolio", description = "거래 내역 가져오기, 보유 종목/로트/실현손익 조회, 가격 보정, 시세 동기화 API")
public class PortfolioController {

    private final TransactionImportService transactionImportService;
    private final PortfolioQueryService portfolioQueryService;
    private final PriceBackfillService priceBackfillService;
    private final QuoteSyncService quoteSyncService;
    private final LedgerRebuildService ledgerRebuildService;

    public PortfolioController(
            TransactionImportService transactionImportService,
            PortfolioQueryService portfolioQueryService,
            PriceBackfillService priceBackfillService,
            QuoteSyncService quoteSyncService,
            LedgerRebuildService ledgerRebuildService
    ) {
        this.transactionImportService = transactionImportService;
        this.portfolioQueryService = portfolioQueryService;
        this.priceBackfillService = priceBackfillService;
        this.quoteSyncService = quoteSyncService;
        this.ledgerRebuildService = ledgerRebuildService;
    }

    @PostMapping(value = "/imports", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "거래 내역 파일 가져오기", description = "증권사 CSV 내보내기 파일을 업로드해 거래를 저장하고 원장을 다시 계산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "가져오기 성공(행 단위 오류 포함 가능)"),
            @ApiResponse(responseCode = "400", description = "빈 파일"),
            @ApiResponse(responseCode = "422", description = "헤더 누락 또는 원장 불변식 위반")
    })
    public ResponseEntity<ImportResultDto> importFile(@RequestPart("file") MultipartFile file) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read uploaded file", e);
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(transactionImportService.importCsv(content));
    }

    @PostMapping(value = "/imports", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    @Operation(summary = "거래 내역 본문 가져오기", description = "요청 본문의 CSV 텍스트를 가져옵니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "가져오기 성공(행 단위 오류 포함 가능)"),
            @ApiResponse(responseCode = "400", description = "빈 본문"),
            @ApiResponse(responseCode = "422", description = "헤더 누락 또는 원장 불변식 위반")
    })
    public ResponseEntity<ImportResultDto> importBody(@RequestBody(required = false) String body) {
        if (body == null || body.isBlank()) {
            throw new LedgerApiException(HttpStatus.BAD_REQUEST, "empty_import", "Import body is empty");
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(transactionImportService.importCsv(body.getBytes(StandardCharsets.UTF_8)));
    }

    @GetMapping("/holdings")
    @Operation(summary = "보유 종목 조회", description = "보유 수량이 남은 종목을 조회합니다. valued=true이면 저장된 시세로 평가합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public List<HoldingDto> getHoldings(@RequestParam(value = "valued", defaultValue = "true") boolean valued) {
        return portfolioQueryService.getHoldings(valued);
    }

    @GetMapping("/holdings/{symbol}")
    @Operation(summary = "종목 평가 조회", description = "한 종목의 보유 현황과 평가 결과를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "종목 없음")
    })
    public HoldingDto getHolding(@PathVariable String symbol) {
        return portfolioQueryService.getHolding(symbol);
    }

    @GetMapping("/holdings/{symbol}/lots")
    @Operation(summary = "로트 조회", description = "종목의 FIFO 로트를 오래된 순서로 조회합니다. 모두 소진된 로트도 포함합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "종목 없음")
    })
    public List<LotDto> getLots(@PathVariable String symbol) {
        return portfolioQueryService.getLots(symbol);
    }

    @GetMapping("/disposals")
    @Operation(summary = "처분 내역 조회", description = "매도 및 비현금 감소로 소진된 로트 내역과 실현손익을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public List<DisposalDto> getDisposals(@RequestParam(value = "symbol", required = false) String symbol) {
        return portfolioQueryService.getDisposals(symbol);
    }

    @GetMapping("/summary")
    @Operation(summary = "포트폴리오 요약", description = "총 투자금, 평가금액, 미실현/실현 손익 합계를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public PortfolioSummaryDto getSummary() {
        return portfolioQueryService.getSummary();
    }

    @GetMapping("/transactions")
    @Operation(summary = "거래 내역 조회", description = "종목, 유형, 기간으로 거래를 필터링해 페이지 단위로 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "400", description = "잘못된 페이지 또는 기간")
    })
    public TransactionPageDto getTransactions(
            @RequestParam(value = "symbol", required = false) String symbol,
            @RequestParam(value = "kind", required = false) EventKind kind,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "50") int size
    ) {
        return portfolioQueryService.getTransactions(symbol, kind, from, to, page, size);
    }

    @GetMapping("/transactions/unpriced")
    @Operation(summary = "가격 미입력 거래 조회", description = "취득원가 또는 매도 금액을 알 수 없어 가격 입력이 필요한 거래를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public List<TransactionDto> getUnpricedTransactions() {
        return priceBackfillService.listUnpriced();
    }

    @PostMapping("/transactions/prices")
    @Operation(summary = "가격 보정", description = "가격이 없는 거래에 단가(매도는 수수료 포함)를 입력하고 원장을 다시 계산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "보정 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "422", description = "원장 불변식 위반")
    })
    public PriceBackfillResultDto backfillPrices(@RequestBody @Valid PriceBackfillRequest request) {
        return priceBackfillService.backfill(request);
    }

    @PostMapping("/quotes/sync")
    @Operation(summary = "시세 동기화", description = "보유 종목의 최신 시세를 즉시 가져옵니다. 실패한 종목은 건너뜁니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "동기화 완료")
    })
    public QuoteSyncResultDto syncQuotes() {
        return quoteSyncService.syncQuotes();
    }

    @PostMapping("/rebuild")
    @Operation(summary = "원장 재계산", description = "저장된 모든 거래로 로트, 처분 내역, 보유 현황을 다시 계산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "재계산 성공"),
            @ApiResponse(responseCode = "422", description = "원장 불변식 위반")
    })
    public RebuildResultDto rebuild() {
        return ledgerRebuildService.rebuild();
    }
}
