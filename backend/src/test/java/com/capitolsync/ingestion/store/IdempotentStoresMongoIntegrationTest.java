package com.capitolsync.ingestion.store;

import com.capitolsync.domain.Bill;
import com.capitolsync.domain.BillRepository;
import com.capitolsync.domain.Chamber;
import com.capitolsync.domain.Committee;
import com.capitolsync.domain.CommitteeRepository;
import com.capitolsync.domain.Legislator;
import com.capitolsync.domain.LegislatorRepository;
import com.capitolsync.domain.Party;
import com.capitolsync.domain.RollCallVote;
import com.capitolsync.domain.RollCallVoteRepository;
import com.capitolsync.domain.VotePosition;
import com.capitolsync.domain.VotePositionRepository;
import com.capitolsync.ingestion.transform.RollCallBundle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest
@Import({IdempotentLegislatorStore.class, IdempotentCommitteeStore.class, IdempotentBillStore.class,
        IdempotentRollCallStore.class})
@Testcontainers(disabledWithoutDocker = true)
class IdempotentStoresMongoIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    IdempotentLegislatorStore legislatorStore;
    @Autowired
    IdempotentCommitteeStore committeeStore;
    @Autowired
    IdempotentBillStore billStore;
    @Autowired
    IdempotentRollCallStore rollCallStore;
    @Autowired
    LegislatorRepository legislatorRepository;
    @Autowired
    CommitteeRepository committeeRepository;
    @Autowired
    BillRepository billRepository;
    @Autowired
    RollCallVoteRepository rollCallRepository;
    @Autowired
    VotePositionRepository positionRepository;

    @BeforeEach
    void clean() {
        positionRepository.deleteAll();
        rollCallRepository.deleteAll();
        billRepository.deleteAll();
        committeeRepository.deleteAll();
        legislatorRepository.deleteAll();
    }

    @Test
    @DisplayName("second upsert of the same legislator updates the single document")
    void legislatorUpsertIsIdempotent() {
        assertThat(legislatorStore.upsert(legislator("P000197", Party.D))).isEqualTo(UpsertResult.CREATED);

        UpsertResult second = legislatorStore.upsert(legislator("P000197", Party.I));

        assertThat(second).isEqualTo(UpsertResult.UPDATED);
        assertThat(legislatorRepository.count()).isEqualTo(1);
        assertThat(legislatorRepository.findById("P000197")).get()
                .extracting(Legislator::getParty).isEqualTo(Party.I);
    }

    @Test
    @DisplayName("bill introduction date survives later updates")
    void billKeepsIntroducedDate() {
        Bill first = bill("hr-1-118");
        first.setIntroducedDate(LocalDate.of(2023, 1, 9));
        billStore.upsert(first);

        Bill later = bill("hr-1-118");
        later.setIntroducedDate(LocalDate.of(2024, 6, 1));
        later.setTitle("Lower Energy Costs Act");

        assertThat(billStore.upsert(later)).isEqualTo(UpsertResult.UPDATED);
        Bill stored = billRepository.findById("hr-1-118").orElseThrow();
        assertThat(stored.getIntroducedDate()).isEqualTo(LocalDate.of(2023, 1, 9));
        assertThat(stored.getTitle()).isEqualTo("Lower Energy Costs Act");
    }

    @Test
    @DisplayName("subcommittee stored before its parent is linked in the second pass")
    void pendingParentLinkedLater() {
        committeeStore.upsert(committee("hsag15", "hsag00"));
        assertThat(committeeRepository.findById("hsag15")).get()
                .extracting(Committee::getParentId, Committee::getPendingParentId)
                .containsExactly(null, "hsag00");

        committeeStore.upsert(committee("hsag00", null));
        int linked = committeeStore.linkPendingParents();

        assertThat(linked).isEqualTo(1);
        assertThat(committeeRepository.findById("hsag15")).get()
                .extracting(Committee::getParentId, Committee::getPendingParentId)
                .containsExactly("hsag00", null);
        assertThat(committeeRepository.findByPendingParentIdIsNotNull()).isEmpty();
    }

    @Test
    @DisplayName("roll call drops unknown bill reference and skips unknown legislators")
    void rollCallReferentialHandling() {
        legislatorStore.upsert(legislator("A000001", Party.R));
        RollCallVote vote = rollCall("h118-1-10", "hr-999-118");
        List<VotePosition> positions = List.of(
                position(vote.getId(), "A000001", VotePosition.Position.YEA),
                position(vote.getId(), "Z999999", VotePosition.Position.NAY));

        IdempotentRollCallStore.RollCallOutcome outcome = rollCallStore.upsert(new RollCallBundle(vote, positions));

        assertThat(outcome.rollCall()).isEqualTo(UpsertResult.CREATED);
        assertThat(outcome.positions()).isEqualTo(new IdempotentRollCallStore.PositionCounts(1, 0, 1));
        assertThat(rollCallRepository.findById("h118-1-10")).get()
                .extracting(RollCallVote::getBillId).isNull();
        assertThat(positionRepository.findDistinctLegislatorIds()).containsExactly("A000001");
        assertThat(positionRepository.findDistinctRollCallIds()).containsExactly("h118-1-10");
    }

    @Test
    @DisplayName("re-importing a roll call updates positions in place")
    void rollCallReimportUpdates() {
        legislatorStore.upsert(legislator("A000001", Party.R));
        billStore.upsert(bill("hr-5-118"));
        RollCallVote vote = rollCall("h118-1-11", "hr-5-118");
        rollCallStore.upsert(new RollCallBundle(vote,
                List.of(position(vote.getId(), "A000001", VotePosition.Position.YEA))));

        RollCallVote again = rollCall("h118-1-11", "hr-5-118");
        IdempotentRollCallStore.RollCallOutcome outcome = rollCallStore.upsert(new RollCallBundle(again,
                List.of(position(again.getId(), "A000001", VotePosition.Position.NAY))));

        assertThat(outcome.rollCall()).isEqualTo(UpsertResult.UPDATED);
        assertThat(outcome.positions()).isEqualTo(new IdempotentRollCallStore.PositionCounts(0, 1, 0));
        assertThat(positionRepository.count()).isEqualTo(1);
        assertThat(positionRepository.findById("h118-1-11:A000001")).get()
                .extracting(VotePosition::getPosition).isEqualTo(VotePosition.Position.NAY);
        assertThat(rollCallRepository.findById("h118-1-11")).get()
                .extracting(RollCallVote::getBillId).isEqualTo("hr-5-118");
    }

    private static Legislator legislator(String id, Party party) {
        Legislator legislator = new Legislator();
        legislator.setId(id);
        legislator.setFirstName("Test");
        legislator.setLastName(id);
        legislator.setFullName(id + ", Test");
        legislator.setParty(party);
        legislator.setChamber(Chamber.HOUSE);
        legislator.setState("OH");
        legislator.setInOffice(true);
        return legislator;
    }

    private static Committee committee(String id, String parentId) {
        Committee committee = new Committee();
        committee.setId(id);
        committee.setName("Committee " + id);
        committee.setChamber(Chamber.HOUSE);
        committee.setType(parentId != null ? Committee.CommitteeType.SUBCOMMITTEE : Committee.CommitteeType.STANDING);
        committee.setParentId(parentId);
        return committee;
    }

    private static Bill bill(String id) {
        String[] parts = id.split("-");
        Bill bill = new Bill();
        bill.setId(id);
        bill.setBillType(Bill.BillType.valueOf(parts[0].toUpperCase()));
        bill.setBillNumber(Integer.parseInt(parts[1]));
        bill.setCongress(Integer.parseInt(parts[2]));
        bill.setTitle("Bill " + id);
        bill.setStatus(Bill.BillStatus.INTRODUCED);
        return bill;
    }

    private static RollCallVote rollCall(String id, String billId) {
        String[] parts = id.substring(1).split("-");
        RollCallVote vote = new RollCallVote();
        vote.setId(id);
        vote.setCongress(Integer.parseInt(parts[0]));
        vote.setChamber(Chamber.HOUSE);
        vote.setSession(Integer.parseInt(parts[1]));
        vote.setRollNumber(Integer.parseInt(parts[2]));
        vote.setBillId(billId);
        vote.setResult(RollCallVote.VoteResult.PASSED);
        return vote;
    }

    private static VotePosition position(String rollCallId, String legislatorId, VotePosition.Position value) {
        VotePosition position = new VotePosition();
        position.setId(VotePosition.idFor(rollCallId, legislatorId));
        position.setRollCallId(rollCallId);
        position.setLegislatorId(legislatorId);
        position.setPosition(value);
        return position;
    }
}
