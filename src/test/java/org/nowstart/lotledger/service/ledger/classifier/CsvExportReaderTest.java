package org.nowstart.lotledger.service.ledger.classifier;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class CsvExportReaderTest {

    private final CsvExportReader reader = new CsvExportReader();

    @Test
    void read_splitsHeaderAndQuotedRows() {
        String csv = """
                "S.N","Scrip","Transaction Date","Credit Quantity","Debit Quantity","Balance After Transaction","History Description"
                "1","API","2025-06-22","50","-","121.0","ON-CR TD:870496 TX:746047 1301020000003172 SET:1211002025130"
                "2","SCB","2025-04-21","1","-","25.0","CA-Bonus                  00009458   B-6.5%-2023-24 CREDIT"
                """;

        CsvExportReader.CsvExport export = reader.read(csv.getBytes(StandardCharsets.UTF_8));

        assertThat(export.header()).containsExactly("S.N", "Scrip", "Transaction Date", "Credit Quantity",
                "Debit Quantity", "Balance After Transaction", "History Description");
        assertThat(export.rows()).hasSize(2);
        assertThat(export.rows().get(1).get(1)).isEqualTo("SCB");
        assertThat(export.rows().get(1).get(6)).startsWith("CA-Bonus").endsWith("CREDIT");
    }

    @Test
    void read_stripsByteOrderMarkAndSkipsBlankLines() {
        String csv = "\uFEFFDate,Symbol,Type,Qty\n\n2024-01-15,NABIL,\"ON-CR, settled\",10\n , , , \n";

        CsvExportReader.CsvExport export = reader.read(csv);

        assertThat(export.header()).containsExactly("Date", "Symbol", "Type", "Qty");
        assertThat(export.rows()).containsExactly(List.of("2024-01-15", "NABIL", "ON-CR, settled", "10"));
    }

    @Test
    void read_emptyContentHasNoHeader() {
        assertThat(reader.read(new byte[0]).header()).isEmpty();
        assertThat(reader.read("   \n").rows()).isEmpty();
        assertThat(reader.read((String) null).header()).isEmpty();
    }
}
