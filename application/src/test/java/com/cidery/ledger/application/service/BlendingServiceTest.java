package com.cidery.ledger.application.service;

import com.cidery.ledger.application.config.JacksonConfig;
import com.cidery.ledger.domain.command.BlendOperation;
import com.cidery.ledger.domain.enums.AuditOperation;
import com.cidery.ledger.domain.enums.BatchStatus;
import com.cidery.ledger.domain.enums.SourceType;
import com.cidery.ledger.domain.enums.TransactionType;
import com.cidery.ledger.domain.enums.VesselStatus;
import com.cidery.ledger.domain.exception.EmptyBlendException;
import com.cidery.ledger.domain.exception.LedgerValidationException;
import com.cidery.ledger.domain.exception.VesselOccupiedException;
import com.cidery.ledger.domain.model.Batch;
import com.cidery.ledger.domain.model.BlendComponent;
import com.cidery.ledger.domain.model.BlendResult;
import com.cidery.ledger.domain.model.LedgerResult;
import com.cidery.ledger.domain.model.Quantity;
import com.cidery.ledger.domain.model.SourceRef;
import com.cidery.ledger.domain.model.detail.BlendDetail;
import com.cidery.ledger.infrastructure.persistence.entity.BatchEntity;
import com.cidery.ledger.infrastructure.persistence.entity.OccupancyEntity;
import com.cidery.ledger.infrastructure.persistence.entity.VesselEntity;
import com.cidery.ledger.infrastructure.persistence.repository.BatchRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BlendingServiceTest {

    @Mock
    private LedgerStore store;
    @Mock
    private BatchRepository batchRepository;

    private BlendingService blendingService;
    private BatchEntity spirit;
    private BatchEntity cider;
    private VesselEntity still;
    private VesselEntity tank;
    private VesselEntity blendTank;

    @BeforeEach
    void setUp() {
        blendingService = new BlendingService(store, batchRepository, new BlendCalculator(),
                new LedgerMapper(new JacksonConfig().objectMapper()));

        spirit = batch("SPIRIT", "40.00", "20.000");
        cider = batch("CIDER", "10.00", "30.000");
        still = vessel("V1");
        tank = vessel("V2");
        blendTank = vessel("V3");
    }

    private static BatchEntity batch(String id, String abv, String liters) {
        return BatchEntity.builder()
                .id(id)
                .name(id)
                .status(BatchStatus.AGING)
                .abvPct(new BigDecimal(abv))
                .currentVolumeLiters(new BigDecimal(liters))
                .build();
    }

    private static VesselEntity vessel(String id) {
        return VesselEntity.builder()
                .id(id)
                .name(id)
                .capacityLiters(new BigDecimal("500"))
                .status(VesselStatus.OCCUPIED)
                .build();
    }

    private static BlendComponent source(String batchId, String vesselId, String liters) {
        return BlendComponent.builder()
                .batchId(batchId)
                .fromVesselId(vesselId)
                .volume(Quantity.liters(liters))
                .build();
    }

    private void stubSources() {
        when(store.resolveSingleVessel("SPIRIT", "V1")).thenReturn("V1");
        when(store.resolveSingleVessel("CIDER", "V2")).thenReturn("V2");
        Map<String, BatchEntity> locked = new LinkedHashMap<>();
        locked.put("SPIRIT", spirit);
        locked.put("CIDER", cider);
        when(store.lockBatches(any())).thenReturn(locked);
        when(store.loadVesselForUpdate("V1")).thenReturn(still);
        when(store.loadVesselForUpdate("V2")).thenReturn(tank);
        when(store.loadVesselForUpdate("V3")).thenReturn(blendTank);
    }

    private void stubAudit() {
        when(store.auditBatch(any(), any(), any(), any())).thenAnswer(invocation ->
                Batch.builder().id(invocation.<BatchEntity>getArgument(3).getId()).build());
    }

    @Test
    void testBlendIntoEmptyVesselCreatesAgingBatch() {
        stubSources();
        when(store.activeOccupancy("V3")).thenReturn(Optional.empty());
        LedgerOperation operation = LedgerOperation.start("BLEND", "blender", null, "corr-1");
        when(store.begin(eq("BLEND"), any(), any())).thenReturn(operation);
        when(batchRepository.saveAndFlush(any(BatchEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
        stubAudit();

        LedgerResult<BlendResult> result = blendingService.applyBlend(BlendOperation.builder()
                .sources(List.of(source("SPIRIT", "V1", "20"), source("CIDER", "V2", "30")))
                .destinationVesselId("V3")
                .build());

        BlendResult blend = result.getValue();
        assertTrue(blend.isNewBatch());
        assertTrue(blend.getDestinationBatchId().startsWith("BLEND-"));
        assertEquals(new BigDecimal("22.00"), blend.getWeightedAbv());
        assertEquals(0, new BigDecimal("50").compareTo(blend.getTotalVolume().getAmount()));
        assertEquals(2, blend.getSourceDeductions().size());

        ArgumentCaptor<BatchEntity> created = ArgumentCaptor.forClass(BatchEntity.class);
        verify(batchRepository).saveAndFlush(created.capture());
        assertEquals(BatchStatus.AGING, created.getValue().getStatus());
        List<SourceRef> composition = new LedgerMapper(new JacksonConfig().objectMapper())
                .readComposition(created.getValue().getCompositionSources());
        assertEquals(new BigDecimal("40.00"), composition.get(0).getPercentage());
        assertEquals(new BigDecimal("60.00"), composition.get(1).getPercentage());

        ArgumentCaptor<EntryDraft> drafts = ArgumentCaptor.forClass(EntryDraft.class);
        verify(store, times(3)).post(eq(operation), eq(TransactionType.BLEND), any(), drafts.capture());
        List<EntryDraft> posted = drafts.getAllValues();
        assertEquals(0, new BigDecimal("-20").compareTo(posted.get(0).getDeltaLiters()));
        assertEquals(0, new BigDecimal("-30").compareTo(posted.get(1).getDeltaLiters()));
        assertEquals(0, new BigDecimal("50").compareTo(posted.get(2).getDeltaLiters()));
        assertEquals(0, posted.stream().map(EntryDraft::getDeltaLiters).reduce(BigDecimal.ZERO, BigDecimal::add).signum());
        assertEquals(BlendDetail.Role.DESTINATION, ((BlendDetail) posted.get(2).getDetail()).getRole());

        verify(store).occupy(operation, blendTank, blend.getDestinationBatchId());
        verify(store).auditBatch(eq(operation), eq(AuditOperation.UPDATE), any(), eq(spirit));
        verify(store).auditBatch(eq(operation), eq(AuditOperation.UPDATE), any(), eq(cider));
        verify(store).auditBatch(eq(operation), eq(AuditOperation.CREATE), isNull(), any());
    }

    @Test
    void testBlendExtendsBatchAlreadyInDestination() {
        BatchEntity house = batch("HOUSE", "22.00", "50.000");
        when(store.resolveSingleVessel("CIDER", "V2")).thenReturn("V2");
        when(store.lockBatches(any())).thenReturn(new LinkedHashMap<>(Map.of("CIDER", cider)));
        when(store.loadVesselForUpdate("V2")).thenReturn(tank);
        when(store.loadVesselForUpdate("V3")).thenReturn(blendTank);
        when(store.activeOccupancy("V3")).thenReturn(Optional.of(OccupancyEntity.builder()
                .vesselId("V3").batchId("HOUSE").build()));
        when(store.loadOpenBatchForUpdate("HOUSE", null)).thenReturn(house);
        LedgerOperation operation = LedgerOperation.start("BLEND", "blender", null, "corr-1");
        when(store.begin(eq("BLEND"), any(), any())).thenReturn(operation);
        stubAudit();

        LedgerResult<BlendResult> result = blendingService.applyBlend(BlendOperation.builder()
                .sources(List.of(source("CIDER", "V2", "50")))
                .destinationVesselId("V3")
                .destinationBatchId("HOUSE")
                .build());

        assertFalse(result.getValue().isNewBatch());
        assertEquals(new BigDecimal("16.00"), result.getValue().getWeightedAbv());
        assertEquals(new BigDecimal("16.00"), house.getAbvPct());
        verify(batchRepository, never()).saveAndFlush(any());
    }

    @Test
    void testBlendCountsDestinationVolumeWhenItHasNoComposition() {
        BatchEntity house = batch("HOUSE", "22.00", "50.000");
        house.setCompositionSources("[]");
        stubExtendHouse(house);

        LedgerResult<BlendResult> result = blendingService.applyBlend(BlendOperation.builder()
                .sources(List.of(source("CIDER", "V2", "50")))
                .destinationVesselId("V3")
                .destinationBatchId("HOUSE")
                .build());

        assertEquals(new BigDecimal("16.00"), result.getValue().getWeightedAbv());
        List<SourceRef> composition = new LedgerMapper(new JacksonConfig().objectMapper())
                .readComposition(house.getCompositionSources());
        assertEquals(2, composition.size());
        assertEquals("HOUSE", composition.get(0).getSourceId());
        assertEquals(SourceType.BATCH, composition.get(0).getSourceType());
        assertEquals(new BigDecimal("50.00"), composition.get(0).getPercentage());
        assertEquals("CIDER", composition.get(1).getSourceId());
        assertEquals(new BigDecimal("50.00"), composition.get(1).getPercentage());
    }

    @Test
    void testBlendScalesDestinationCompositionToItsCurrentVolume() {
        BatchEntity house = batch("HOUSE", "22.00", "50.000");
        // 100 L pressed, half of it since lost or removed
        house.setCompositionSources("[{\"sourceType\":\"PRESS_RUN\",\"sourceId\":\"PR-1\",\"volumeLiters\":60},"
                + "{\"sourceType\":\"PRESS_RUN\",\"sourceId\":\"PR-2\",\"volumeLiters\":40}]");
        stubExtendHouse(house);

        blendingService.applyBlend(BlendOperation.builder()
                .sources(List.of(source("CIDER", "V2", "50")))
                .destinationVesselId("V3")
                .destinationBatchId("HOUSE")
                .build());

        List<SourceRef> composition = new LedgerMapper(new JacksonConfig().objectMapper())
                .readComposition(house.getCompositionSources());
        assertEquals(3, composition.size());
        assertEquals(0, new BigDecimal("30").compareTo(composition.get(0).getVolumeLiters()));
        assertEquals(new BigDecimal("30.00"), composition.get(0).getPercentage());
        assertEquals(new BigDecimal("20.00"), composition.get(1).getPercentage());
        assertEquals(new BigDecimal("50.00"), composition.get(2).getPercentage());
    }

    private void stubExtendHouse(BatchEntity house) {
        when(store.resolveSingleVessel("CIDER", "V2")).thenReturn("V2");
        when(store.lockBatches(any())).thenReturn(new LinkedHashMap<>(Map.of("CIDER", cider)));
        when(store.loadVesselForUpdate("V2")).thenReturn(tank);
        when(store.loadVesselForUpdate("V3")).thenReturn(blendTank);
        when(store.activeOccupancy("V3")).thenReturn(Optional.of(OccupancyEntity.builder()
                .vesselId("V3").batchId("HOUSE").build()));
        when(store.loadOpenBatchForUpdate("HOUSE", null)).thenReturn(house);
        when(store.begin(eq("BLEND"), any(), any())).thenReturn(LedgerOperation.start("BLEND", "blender", null, "c"));
        stubAudit();
    }

    @Test
    void testBlendIntoSourceBatchRejected() {
        LedgerValidationException e = assertThrows(LedgerValidationException.class,
                () -> blendingService.applyBlend(BlendOperation.builder()
                        .sources(List.of(source("SPIRIT", "V1", "20")))
                        .destinationVesselId("V1")
                        .destinationBatchId("SPIRIT")
                        .build()));

        assertEquals("BLEND_INTO_SOURCE", e.getCode());
        verifyNoInteractions(store);
    }

    @Test
    void testBlendIntoVesselHoldingAnotherBatchWritesNothing() {
        stubSources();
        when(store.activeOccupancy("V3")).thenReturn(Optional.of(OccupancyEntity.builder()
                .vesselId("V3").batchId("PERRY").build()));

        assertThrows(VesselOccupiedException.class, () -> blendingService.applyBlend(BlendOperation.builder()
                .sources(List.of(source("SPIRIT", "V1", "20"), source("CIDER", "V2", "30")))
                .destinationVesselId("V3")
                .build()));

        verify(store, never()).begin(any(), any(), any());
        verify(store, never()).post(any(), any(), any(), any());
    }

    @Test
    void testEmptyBlendRejected() {
        assertThrows(EmptyBlendException.class, () -> blendingService.applyBlend(BlendOperation.builder()
                .destinationVesselId("V3")
                .build()));
    }
}
