package com.cidery.ledger.integration;

import com.cidery.ledger.application.audit.AuditService;
import com.cidery.ledger.application.service.LedgerCommandGateway;
import com.cidery.ledger.application.service.LedgerQueryService;
import com.cidery.ledger.domain.command.AssignBatchCommand;
import com.cidery.ledger.domain.command.BlendOperation;
import com.cidery.ledger.domain.command.ReconcilePeriodCommand;
import com.cidery.ledger.domain.command.RecordLossCommand;
import com.cidery.ledger.domain.command.RegisterBatchCommand;
import com.cidery.ledger.domain.command.RegisterVesselCommand;
import com.cidery.ledger.domain.command.TransferVolumeCommand;
import com.cidery.ledger.domain.enums.AuditOperation;
import com.cidery.ledger.domain.enums.BatchStatus;
import com.cidery.ledger.domain.enums.LossType;
import com.cidery.ledger.domain.enums.TransactionType;
import com.cidery.ledger.domain.exception.LedgerConflictException;
import com.cidery.ledger.domain.exception.VesselOccupiedException;
import com.cidery.ledger.domain.model.AuditLogEntry;
import com.cidery.ledger.domain.model.Batch;
import com.cidery.ledger.domain.model.BlendComponent;
import com.cidery.ledger.domain.model.BlendResult;
import com.cidery.ledger.domain.model.Quantity;
import com.cidery.ledger.domain.model.ReconciliationSnapshot;
import com.cidery.ledger.domain.model.ReportingPeriod;
import com.cidery.ledger.domain.model.TransactionEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-End Integration Test
 *
 * Runs ledger operations against PostgreSQL and checks:
 * 1. Volumes are conserved across transfers and blends
 * 2. Every change leaves an audit entry with a valid checksum
 * 3. The period report reconciles with the transaction log
 * 4. Concurrent writers never lose an update
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class LedgerEndToEndTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:14-alpine"))
            .withDatabaseName("cidery_ledger")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private LedgerCommandGateway commandGateway;

    @Autowired
    private LedgerQueryService queryService;

    private static final AtomicInteger testCounter = new AtomicInteger();
    private String prefix;

    @BeforeEach
    void setUp() {
        // Unique ids per test, the container is shared by the whole class
        prefix = "E2E" + testCounter.incrementAndGet() + "-" + System.currentTimeMillis() % 100000 + "-";
    }

    private String vessel(String name, String capacityLiters) {
        String id = prefix + name;
        commandGateway.registerVessel(RegisterVesselCommand.builder()
                .vesselId(id)
                .name(name)
                .capacity(Quantity.liters(capacityLiters))
                .location("Cellar A")
                .actorId("cellar-master")
                .build());
        return id;
    }

    private String batch(String name, String abvPct, String vesselId, String liters) {
        String id = prefix + name;
        RegisterBatchCommand register = new RegisterBatchCommand();
        register.setBatchId(id);
        register.setName(name);
        register.setAbvPct(new BigDecimal(abvPct));
        register.setActorId("cellar-master");
        commandGateway.registerBatch(register);

        commandGateway.assignBatchToVessel(AssignBatchCommand.builder()
                .batchId(id)
                .vesselId(vesselId)
                .quantity(Quantity.liters(liters))
                .actorId("cellar-master")
                .build());
        return id;
    }

    private static void assertLiters(String expected, Quantity actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual.toLiters()),
                () -> "expected " + expected + " L but was " + actual);
    }

    @Test
    void testDistillAndBlend() {
        String spiritTank = vessel("STILL-RECEIVER", "100");
        String ciderTank = vessel("CIDER-TANK", "100");
        String blendTank = vessel("POMMEAU-TANK", "100");
        String spirit = batch("APPLE-BRANDY", "40", spiritTank, "20");
        String cider = batch("DABINETT", "10", ciderTank, "30");

        BlendOperation blend = new BlendOperation();
        blend.setSources(List.of(
                BlendComponent.builder().batchId(spirit).fromVesselId(spiritTank)
                        .volume(Quantity.liters("20")).abvPct(new BigDecimal("40")).build(),
                BlendComponent.builder().batchId(cider).fromVesselId(ciderTank)
                        .volume(Quantity.liters("30")).abvPct(new BigDecimal("10")).build()));
        blend.setDestinationVesselId(blendTank);
        blend.setDestinationBatchName("Pommeau 2024");
        blend.setActorId("blender");

        BlendResult result = commandGateway.createBlend(blend).getValue();

        assertTrue(result.isNewBatch());
        assertEquals(0, new BigDecimal("22.00").compareTo(result.getWeightedAbv()));
        assertLiters("50", result.getTotalVolume());

        Batch pommeau = queryService.getBatch(result.getDestinationBatchId());
        assertEquals(BatchStatus.AGING, pommeau.getStatus());
        assertLiters("50", pommeau.getCurrentVolume());
        assertEquals(2, pommeau.getCompositionSources().size());

        // Sources are drained and their vessels released
        assertLiters("0", queryService.getCurrentVolume(spirit));
        assertLiters("0", queryService.getCurrentVolume(cider));
        assertTrue(queryService.getVesselOccupant(spiritTank).isEmpty());
        assertTrue(queryService.getVesselOccupant(ciderTank).isEmpty());
        assertEquals(result.getDestinationBatchId(), queryService.getVesselOccupant(blendTank).orElseThrow());

        // The blend entries net to zero across the three batches
        BigDecimal net = BigDecimal.ZERO;
        for (String batchId : List.of(spirit, cider, result.getDestinationBatchId())) {
            for (TransactionEntry entry : queryService.getTransactionHistory(batchId, 0, 100)) {
                if (entry.getType() == TransactionType.BLEND) {
                    net = net.add(entry.getQuantityDelta().getAmount());
                }
            }
        }
        assertEquals(0, net.signum());
    }

    @Test
    void testTransferConservesVolumeAndIsAudited() {
        String press = vessel("PRESS-TANK", "500");
        String fermenter = vessel("FERMENTER", "500");
        String batchId = batch("KINGSTON-BLACK", "6.5", press, "400");

        Batch afterTransfer = commandGateway.transferVolume(TransferVolumeCommand.builder()
                .batchId(batchId)
                .fromVesselId(press)
                .toVesselId(fermenter)
                .quantity(Quantity.liters("390"))
                .loss(Quantity.liters("10"))
                .reason("racking off the gross lees")
                .actorId("racker")
                .build()).getValue();

        assertLiters("390", afterTransfer.getCurrentVolume());
        assertTrue(queryService.getVesselOccupant(press).isEmpty());
        assertEquals(batchId, queryService.getVesselOccupant(fermenter).orElseThrow());

        Batch verified = queryService.verifyBatchIntegrity(batchId);
        assertLiters("390", verified.getCurrentVolume());

        List<AuditLogEntry> history = queryService.getAuditHistory(AuditService.TABLE_BATCHES, batchId);
        assertFalse(history.isEmpty());
        assertEquals(AuditOperation.CREATE, history.get(0).getOperation());
        assertTrue(history.stream().anyMatch(entry -> "racker".equals(entry.getActor())));
        for (AuditLogEntry entry : history) {
            assertTrue(queryService.verifyAuditEntry(entry.getId()), "checksum of " + entry.getId());
        }
    }

    @Test
    void testSecondBatchCannotEnterOccupiedVessel() {
        String tank = vessel("SHARED-TANK", "200");
        batch("FIRST", "6", tank, "100");

        RegisterBatchCommand register = new RegisterBatchCommand();
        register.setBatchId(prefix + "SECOND");
        register.setName("SECOND");
        commandGateway.registerBatch(register);

        assertThrows(VesselOccupiedException.class, () -> commandGateway.assignBatchToVessel(AssignBatchCommand.builder()
                .batchId(prefix + "SECOND")
                .vesselId(tank)
                .quantity(Quantity.liters("50"))
                .build()));
        assertLiters("0", queryService.getCurrentVolume(prefix + "SECOND"));
    }

    @Test
    void testPeriodReconcilesWithLog() {
        String tank = vessel("RECON-TANK", "1000");
        String batchId = batch("RECON-CIDER", "6", tank, "378.541");
        RecordLossCommand loss = new RecordLossCommand();
        loss.setBatchId(batchId);
        loss.setVesselId(tank);
        loss.setQuantity(Quantity.liters("3.78541"));
        loss.setLossType(LossType.SPOILAGE);
        commandGateway.recordLoss(loss);

        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        ReconcilePeriodCommand command = new ReconcilePeriodCommand();
        command.setPeriod(ReportingPeriod.monthly(now.getYear(), now.getMonthValue()));
        command.setActorId("bookkeeper");

        ReconciliationSnapshot snapshot = commandGateway.reconcilePeriod(command).getValue();

        assertTrue(snapshot.isBalanced(), () -> "discrepancies: " + snapshot.getDiscrepancies());
        assertFalse(snapshot.getLines().isEmpty());
        assertTrue(queryService.getReconciliationSnapshot(command.getPeriod()).isPresent());
    }

    @Test
    void testConcurrentLossesNeverLoseAnUpdate() throws Exception {
        String tank = vessel("CONTENDED-TANK", "200");
        String batchId = batch("CONTENDED", "6", tank, "100");

        int writers = 4;
        int lossesPerWriter = 5;
        AtomicInteger committed = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < lossesPerWriter; i++) {
                        RecordLossCommand loss = new RecordLossCommand();
                        loss.setBatchId(batchId);
                        loss.setVesselId(tank);
                        loss.setQuantity(Quantity.liters("1"));
                        loss.setLossType(LossType.OTHER);
                        try {
                            commandGateway.recordLoss(loss);
                            committed.incrementAndGet();
                        } catch (LedgerConflictException e) {
                            rejected.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(writers * lossesPerWriter, committed.get() + rejected.get());
        assertTrue(committed.get() > 0);
        Batch verified = queryService.verifyBatchIntegrity(batchId);
        assertLiters(String.valueOf(100 - committed.get()), verified.getCurrentVolume());
    }
}
