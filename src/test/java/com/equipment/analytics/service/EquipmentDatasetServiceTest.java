package com.equipment.analytics.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.equipment.analytics.exception.EmptyResultException;
import com.equipment.analytics.exception.InvalidUploadException;
import com.equipment.analytics.exception.MalformedInputException;
import com.equipment.analytics.model.Dataset;
import com.equipment.analytics.model.DatasetDraft;
import com.equipment.analytics.model.DuplicateNamePolicy;
import com.equipment.analytics.model.EquipmentRecord;
import com.equipment.analytics.model.EquipmentType;
import com.equipment.analytics.model.RowRejection;
import com.equipment.analytics.model.SkippedRow;
import com.equipment.analytics.model.response.DashboardResponse;
import com.equipment.analytics.model.response.EquipmentEntry;
import com.equipment.analytics.model.response.EquipmentListResponse;
import com.equipment.analytics.model.response.UploadResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EquipmentDatasetServiceTest {

    private static final String HEADER = "Equipment Name,Type,Flowrate,Pressure,Temperature\n";
    private static final Instant UPLOADED_AT = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private RetentionManager retentionManager;

    private EquipmentDatasetService service;

    @BeforeEach
    void setUp() {
        service = new EquipmentDatasetService(
                new CsvTableReader(),
                new DatasetBuilder(new RecordNormalizer(), DuplicateNamePolicy.KEEP_FIRST),
                retentionManager,
                new AnalyticsEngine(),
                1024);
    }

    @Test
    void uploadIngestsValidRowsAndReportsSkippedOnes() {
        when(retentionManager.ingest(eq("alice"), any(DatasetDraft.class)))
                .thenAnswer(invocation -> persisted(42L, "alice", invocation.getArgument(1)));

        UploadResponse response = service.upload("alice", "plant.csv",
                csv("P-1,Pump,100,5,60\nP-1,Pump,bad,5,60\nR-1,reactor,50,10,200"), null);

        assertThat(response.success()).isTrue();
        assertThat(response.datasetId()).isEqualTo(42L);
        assertThat(response.message()).isEqualTo("Successfully uploaded 2 equipment records");
        assertThat(response.dataset().name()).isEqualTo("plant.csv");
        assertThat(response.dataset().rowCount()).isEqualTo(2);
        assertThat(response.skippedRows())
                .containsExactly(new SkippedRow(2, RowRejection.invalidNumber("flowrate", "bad")));

        ArgumentCaptor<DatasetDraft> draft = ArgumentCaptor.forClass(DatasetDraft.class);
        verify(retentionManager).ingest(eq("alice"), draft.capture());
        assertThat(draft.getValue().getSourceFilename()).isEqualTo("plant.csv");
        assertThat(draft.getValue().getRecords()).extracting(EquipmentRecord::type)
                .containsExactly(EquipmentType.PUMP, EquipmentType.REACTOR);
    }

    @Test
    void uploadUsesGivenNameWhenPresent() {
        when(retentionManager.ingest(eq("alice"), any(DatasetDraft.class)))
                .thenAnswer(invocation -> persisted(1L, "alice", invocation.getArgument(1)));

        UploadResponse response = service.upload("alice", "plant.csv", csv("P-1,Pump,1,2,3"), "  March run ");

        assertThat(response.dataset().name()).isEqualTo("March run");
    }

    @Test
    void uploadRejectsNonCsvFiles() {
        assertThatThrownBy(() -> service.upload("alice", "plant.xlsx", csv("P-1,Pump,1,2,3"), null))
                .isInstanceOf(InvalidUploadException.class)
                .hasMessage("Only CSV files are allowed.");
        verifyNoInteractions(retentionManager);
    }

    @Test
    void uploadAcceptsUpperCaseExtension() {
        when(retentionManager.ingest(eq("alice"), any(DatasetDraft.class)))
                .thenAnswer(invocation -> persisted(1L, "alice", invocation.getArgument(1)));

        assertThat(service.upload("alice", "PLANT.CSV", csv("P-1,Pump,1,2,3"), null).success()).isTrue();
    }

    @Test
    void uploadRejectsOversizedFiles() {
        byte[] content = new byte[1025];

        assertThatThrownBy(() -> service.upload("alice", "big.csv", content, null))
                .isInstanceOf(InvalidUploadException.class);
        verifyNoInteractions(retentionManager);
    }

    @Test
    void uploadRejectsOverlongNames() {
        assertThatThrownBy(() -> service.upload("alice", "plant.csv", csv("P-1,Pump,1,2,3"), "n".repeat(256)))
                .isInstanceOf(InvalidUploadException.class);
    }

    @Test
    void uploadRejectsOverlongFileNameWhenItBecomesTheDatasetName() {
        String filename = "f".repeat(300) + ".csv";

        assertThatThrownBy(() -> service.upload("alice", filename, csv("P-1,Pump,1,2,3"), null))
                .isInstanceOf(InvalidUploadException.class)
                .hasMessageContaining("at most 255");
        verifyNoInteractions(retentionManager);
    }

    @Test
    void uploadKeepsOverlongFileNameWhenANameIsGiven() {
        String filename = "f".repeat(300) + ".csv";
        when(retentionManager.ingest(eq("alice"), any(DatasetDraft.class)))
                .thenAnswer(invocation -> persisted(1L, "alice", invocation.getArgument(1)));

        UploadResponse response = service.upload("alice", filename, csv("P-1,Pump,1,2,3"), "short");

        assertThat(response.dataset().name()).isEqualTo("short");
        ArgumentCaptor<DatasetDraft> draft = ArgumentCaptor.forClass(DatasetDraft.class);
        verify(retentionManager).ingest(eq("alice"), draft.capture());
        assertThat(draft.getValue().getSourceFilename()).isEqualTo(filename);
    }

    @Test
    void uploadRejectsOverlongOwnerIds() {
        String owner = "o".repeat(256);

        assertThatThrownBy(() -> service.upload(owner, "plant.csv", csv("P-1,Pump,1,2,3"), null))
                .isInstanceOf(InvalidUploadException.class)
                .hasMessageContaining("Owner id");
        verifyNoInteractions(retentionManager);
    }

    @Test
    void uploadWithoutValidRowsPersistsNothing() {
        EmptyResultException error = assertThrows(EmptyResultException.class,
                () -> service.upload("alice", "plant.csv", csv(",Pump,1,2,3\nP-2,Pump,x,2,3"), null));

        assertThat(error.getSkippedRows()).hasSize(2);
        verifyNoInteractions(retentionManager);
    }

    @Test
    void uploadWithMissingColumnsIsMalformed() {
        byte[] content = "Name,Type\nP-1,Pump".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> service.upload("alice", "plant.csv", content, null))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("Missing required columns");
        verifyNoInteractions(retentionManager);
    }

    @Test
    void dashboardAggregatesAllRetainedDatasets() {
        when(retentionManager.findAll("alice")).thenReturn(List.of(
                dataset(2L, new EquipmentRecord("P-1", EquipmentType.PUMP, 10, 1, 1)),
                dataset(1L,
                        new EquipmentRecord("P-1", EquipmentType.PUMP, 30, 1, 1),
                        new EquipmentRecord("V-1", EquipmentType.VALVE, 5, 1, 1))));

        DashboardResponse dashboard = service.dashboard("alice");

        assertThat(dashboard.datasetsCount()).isEqualTo(2);
        assertThat(dashboard.totalEquipment()).isEqualTo(3);
        assertThat(dashboard.summary().typeDistribution()).containsEntry("Pump", 2L).containsEntry("Valve", 1L);
    }

    @Test
    void dashboardWithoutDatasetsIsEmpty() {
        when(retentionManager.findAll("alice")).thenReturn(List.of());

        DashboardResponse dashboard = service.dashboard("alice");

        assertThat(dashboard.datasetsCount()).isZero();
        assertThat(dashboard.summary().averages()).isNull();
    }

    @Test
    void equipmentCanBeFilteredByDatasetAndType() {
        when(retentionManager.findAll("alice")).thenReturn(List.of(
                dataset(2L,
                        new EquipmentRecord("P-9", EquipmentType.PUMP, 1, 1, 1),
                        new EquipmentRecord("H-9", EquipmentType.HEAT_EXCHANGER, 1, 1, 1)),
                dataset(1L, new EquipmentRecord("P-1", EquipmentType.PUMP, 1, 1, 1))));

        EquipmentListResponse all = service.equipment("alice", null, null);
        EquipmentListResponse pumps = service.equipment("alice", null, "pump");
        EquipmentListResponse exchangersOfTwo = service.equipment("alice", 2L, "heat exchanger");
        EquipmentListResponse unknownType = service.equipment("alice", null, "Centrifuge");

        assertThat(all.count()).isEqualTo(3);
        assertThat(pumps.results()).extracting(EquipmentEntry::name).containsExactly("P-9", "P-1");
        assertThat(exchangersOfTwo.results()).extracting(EquipmentEntry::datasetId).containsExactly(2L);
        assertThat(unknownType.count()).isZero();
    }

    @Test
    void deleteDelegatesToRetentionManager() {
        service.delete("alice", 7L);

        verify(retentionManager).delete("alice", 7L);
    }

    private static byte[] csv(String rows) {
        return (HEADER + rows).getBytes(StandardCharsets.UTF_8);
    }

    private static Dataset persisted(long id, String owner, DatasetDraft draft) {
        return Dataset.builder()
                .id(id)
                .ownerId(owner)
                .name(draft.getName())
                .sourceFilename(draft.getSourceFilename())
                .uploadedAt(UPLOADED_AT)
                .records(draft.getRecords())
                .warnings(draft.getWarnings())
                .build();
    }

    private static Dataset dataset(long id, EquipmentRecord... records) {
        return Dataset.builder()
                .id(id)
                .ownerId("alice")
                .name("ds-" + id)
                .uploadedAt(UPLOADED_AT)
                .records(List.of(records))
                .build();
    }
}
