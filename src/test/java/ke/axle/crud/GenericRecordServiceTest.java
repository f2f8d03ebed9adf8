package ke.axle.crud;

import ke.axle.crud.exceptions.CommitFailed;
import ke.axle.crud.exceptions.MultipleResultsFound;
import ke.axle.crud.exceptions.NotFound;
import ke.axle.crud.fixtures.Membership;
import ke.axle.crud.fixtures.MembershipId;
import ke.axle.crud.fixtures.Player;
import ke.axle.crud.fixtures.PlayerCreate;
import ke.axle.crud.fixtures.PlayerService;
import ke.axle.crud.fixtures.PlayerUpdate;
import ke.axle.crud.key.PrimaryKey;
import ke.axle.crud.query.SelectStatement;
import ke.axle.crud.session.QueryResult;
import ke.axle.crud.session.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.util.Pair;

import javax.persistence.PersistenceException;
import javax.validation.ConstraintViolationException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Checks how the service drives its session, with the session mocked out.
 */
@ExtendWith(MockitoExtension.class)
public class GenericRecordServiceTest {

    @Mock
    private Session session;

    private PlayerService players;

    @BeforeEach
    void setUp() {
        players = new PlayerService(session);
    }

    private static QueryResult<Object> rows(Object... rows) {
        return new QueryResult<>(Arrays.asList(rows));
    }

    @Test
    void testCreate_StagesCommitsThenRefreshes() throws Exception {
        Player created = players.create(new PlayerCreate("Ann", "t1", 3));

        assertEquals("Ann", created.getName());
        assertEquals("t1", created.getTeamId());
        assertEquals(3, created.getScore());

        InOrder inOrder = inOrder(session);
        inOrder.verify(session).add(created);
        inOrder.verify(session).commit();
        inOrder.verify(session).refresh(created);
        verify(session, never()).rollback();
    }

    @Test
    void testCreate_RollsBackAndRaisesCommitFailed_WhenCommitFails() {
        PersistenceException failure = new PersistenceException("constraint violated");
        doThrow(failure).when(session).commit();

        CommitFailed thrown = assertThrows(CommitFailed.class, () -> players.create(new PlayerCreate("Ann")));

        assertSame(failure, thrown.getCause());
        InOrder inOrder = inOrder(session);
        inOrder.verify(session).commit();
        inOrder.verify(session).rollback();
        verify(session, never()).refresh(any());
    }

    @Test
    void testCommitFailed_KeepsRollbackFailureAsSuppressed() {
        PersistenceException failure = new PersistenceException("commit");
        IllegalStateException rollbackFailure = new IllegalStateException("rollback");
        doThrow(failure).when(session).commit();
        doThrow(rollbackFailure).when(session).rollback();

        CommitFailed thrown = assertThrows(CommitFailed.class, () -> players.create(new PlayerCreate("Ann")));

        assertSame(failure, thrown.getCause());
        assertArrayEquals(new Throwable[]{rollbackFailure}, failure.getSuppressed());
    }

    @Test
    void testCreate_RejectsInvalidInput_WithoutTouchingSession() {
        assertThrows(ConstraintViolationException.class, () -> players.create(new PlayerCreate(" ")));

        verifyNoInteractions(session);
    }

    @Test
    void testCreateMultiple_CommitsOnceAndDoesNotRefresh() throws Exception {
        List<Player> created = players.createMultiple(Arrays.asList(new PlayerCreate("Ann"), new PlayerCreate("Bo")));

        assertEquals(2, created.size());
        assertEquals("Ann", created.get(0).getName());
        assertEquals("Bo", created.get(1).getName());
        verify(session).addAll(created);
        verify(session, times(1)).commit();
        verify(session, never()).refresh(any());
    }

    @Test
    void testAddToSession_EmptyItemsWithCommit_CommitsExactlyOnce() throws Exception {
        List<Player> staged = players.addToSession(Collections.emptyList(), true, Operation.CREATE);

        assertTrue(staged.isEmpty());
        verify(session).addAll(Collections.emptyList());
        verify(session, times(1)).commit();
    }

    @Test
    void testAddToSession_WithoutCommit_NeverCommits() throws Exception {
        List<Player> staged = players.addToSession(Arrays.asList(new PlayerCreate("Ann")), false);

        assertEquals(1, staged.size());
        verify(session).addAll(staged);
        verify(session, never()).commit();
        verify(session, never()).refresh(any());
    }

    @Test
    void testAddToSession_RejectsMissingOperation() {
        assertThrows(IllegalArgumentException.class,
                () -> players.addToSession(Collections.emptyList(), true, null));

        verifyNoInteractions(session);
    }

    @Test
    void testAddUpdatesToSession_AppliesChangesToEachItem() throws Exception {
        Player ann = new Player("Ann", 1);
        Player bo = new Player("Bo", 2);

        List<Player> staged = players.addUpdatesToSession(Arrays.asList(
                Pair.of(ann, new PlayerUpdate().withScore(10)),
                Pair.of(bo, new PlayerUpdate().withName("Bob"))), true);

        assertSame(ann, staged.get(0));
        assertSame(bo, staged.get(1));
        assertEquals(10, ann.getScore());
        assertEquals("Ann", ann.getName());
        assertEquals("Bob", bo.getName());
        assertEquals(2, bo.getScore());
        verify(session).commit();
        verify(session, never()).refresh(any());
    }

    @Test
    void testUpdate_RaisesNotFound_AndDoesNotMutate() {
        when(session.get(Player.class, 9L)).thenReturn(null);

        NotFound thrown = assertThrows(NotFound.class, () -> players.update(9L, new PlayerUpdate().withName("x")));

        assertEquals("9", thrown.getMessage());
        verify(session, never()).add(any());
        verify(session, never()).commit();
    }

    @Test
    void testUpdate_ChangesOnlyExplicitlySetFields() throws Exception {
        Player ann = new Player("Ann", 5);
        ann.setTeamId("t1");
        when(session.get(Player.class, 1L)).thenReturn(ann);

        Player updated = players.update(1L, new PlayerUpdate().withScore(8));

        assertSame(ann, updated);
        assertEquals("Ann", updated.getName());
        assertEquals("t1", updated.getTeamId());
        assertEquals(8, updated.getScore());
        InOrder inOrder = inOrder(session);
        inOrder.verify(session).add(ann);
        inOrder.verify(session).commit();
        inOrder.verify(session).refresh(ann);
    }

    @Test
    void testUpdateItem_ExplicitNullClearsField() throws Exception {
        Player ann = new Player("Ann", 5);
        ann.setTeamId("t1");

        players.updateItem(ann, new PlayerUpdate().withTeamId(null));

        assertNull(ann.getTeamId());
        assertEquals(5, ann.getScore());
        verify(session, never()).get(any(), any());
    }

    @Test
    void testDeleteByKey_RaisesNotFound_AndDoesNotMutate() {
        when(session.get(Player.class, 4L)).thenReturn(null);

        assertThrows(NotFound.class, () -> players.deleteByKey(4L));

        verify(session, never()).delete(any());
        verify(session, never()).commit();
    }

    @Test
    void testDeleteByKey_DeletesAndCommits() throws Exception {
        Player ann = new Player("Ann", 5);
        when(session.get(Player.class, 1L)).thenReturn(ann);

        players.deleteByKey(1L);

        InOrder inOrder = inOrder(session);
        inOrder.verify(session).delete(ann);
        inOrder.verify(session).commit();
    }

    @Test
    void testDeleteByKey_RaisesCommitFailed_WhenCommitFails() {
        Player ann = new Player("Ann", 5);
        when(session.get(Player.class, 1L)).thenReturn(ann);
        doThrow(new PersistenceException("locked")).when(session).commit();

        CommitFailed thrown = assertThrows(CommitFailed.class, () -> players.deleteByKey(1L));

        assertEquals("Failed to delete item.", thrown.getMessage());
        verify(session).rollback();
    }

    @Test
    void testGetByKey_ReturnsNull_WhenAbsent() {
        when(session.get(Player.class, 2L)).thenReturn(null);

        assertNull(players.getByKey(2L));
    }

    @Test
    void testGetByKeys_EmptyKeys_DoesNotQuery() {
        assertTrue(players.getByKeys(Collections.emptyList()).isEmpty());

        verifyNoInteractions(session);
    }

    @Test
    void testOne_RaisesNotFound_WhenNothingMatches() {
        doReturn(rows()).when(session).execute(any());

        assertThrows(NotFound.class, () -> players.one((root, cb) -> cb.equal(root.get("name"), "nobody")));
    }

    @Test
    void testOne_RaisesMultipleResultsFound_WhenSeveralMatch() {
        doReturn(rows(new Player("Ann", 1), new Player("Bo", 1))).when(session).execute(any());

        assertThrows(MultipleResultsFound.class, () -> players.one((root, cb) -> cb.equal(root.get("score"), 1)));
    }

    @Test
    void testOne_ReturnsTheOnlyMatch() throws Exception {
        Player ann = new Player("Ann", 1);
        doReturn(rows(ann)).when(session).execute(any());

        assertSame(ann, players.one((root, cb) -> cb.equal(root.get("name"), "Ann")));
    }

    @Test
    void testOneOrNone_ReturnsNull_WhenNothingMatches() throws Exception {
        doReturn(rows()).when(session).execute(any());

        assertNull(players.oneOrNone((root, cb) -> cb.equal(root.get("name"), "nobody")));
    }

    @Test
    void testOneOrNone_RaisesMultipleResultsFound_WhenSeveralMatch() {
        doReturn(rows(new Player("Ann", 1), new Player("Bo", 1))).when(session).execute(any());

        assertThrows(MultipleResultsFound.class,
                () -> players.oneOrNone((root, cb) -> cb.equal(root.get("score"), 1)));
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void testAll_BuildsStatementFromArguments() {
        doReturn(rows()).when(session).execute(any());
        ArgumentCaptor<SelectStatement> captor = ArgumentCaptor.forClass(SelectStatement.class);

        players.all((root, cb) -> cb.isNotNull(root.get("name")), Sort.by("name").and(Sort.by("score")), 5, 10);

        verify(session).execute(captor.capture());
        SelectStatement<Player> statement = captor.getValue();
        assertEquals(Collections.singletonList(Player.class), statement.getTypes());
        assertEquals(1, statement.getConditions().size());
        assertEquals(2, statement.getOrderings().size());
        assertEquals(5, statement.getLimit());
        assertEquals(10, statement.getOffset());
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void testAll_ClampsPageOffsetToIntRange() {
        doReturn(rows()).when(session).execute(any());
        ArgumentCaptor<SelectStatement> captor = ArgumentCaptor.forClass(SelectStatement.class);

        players.all(null, PageRequest.of(Integer.MAX_VALUE, 2));

        verify(session).execute(captor.capture());
        SelectStatement<Player> statement = captor.getValue();
        assertEquals(2, statement.getLimit());
        assertEquals(Integer.MAX_VALUE, statement.getOffset());
    }

    @Test
    void testGetByKeys_RejectsCompositePrimaryKeys() {
        GenericRecordService<Player, PlayerCreate, PlayerUpdate, PrimaryKey> service =
                new GenericRecordService<>(session, Player.class);

        assertThrows(IllegalArgumentException.class,
                () -> service.getByKeys(Arrays.asList(PrimaryKey.of(1L), PrimaryKey.tuple(1L, 2L))));

        verifyNoInteractions(session);
    }

    @Test
    void testPrepareForCreate_BindsMapInput() {
        GenericRecordService<Player, Map<String, Object>, PlayerUpdate, Long> service =
                new GenericRecordService<>(session, Player.class);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", "Ann");
        data.put("score", 4);

        Player player = service.prepareForCreate(data);

        assertEquals("Ann", player.getName());
        assertEquals(4, player.getScore());
    }

    @Test
    void testPrepareForUpdate_OmitsUnsetFields() {
        Map<String, Object> changes = players.prepareForUpdate(new PlayerUpdate().withName("Ann").withTeamId(null));

        assertEquals(2, changes.size());
        assertEquals("Ann", changes.get("name"));
        assertTrue(changes.containsKey("teamId"));
        assertNull(changes.get("teamId"));
        assertFalse(changes.containsKey("score"));
    }

    @Test
    void testFormatKey_RendersCompositeKeysInNotFound() {
        GenericRecordService<Membership, Membership, Map<String, Object>, Object> memberships =
                new GenericRecordService<>(session, Membership.class);
        Map<String, Object> key = new LinkedHashMap<>();
        key.put("teamId", "t1");
        key.put("playerId", 9L);

        NotFound thrown = assertThrows(NotFound.class, () -> memberships.deleteByKey(key));

        assertEquals("teamId:t1|playerId:9", thrown.getMessage());
        assertEquals("t1|9", memberships.formatKey(Arrays.asList("t1", 9L)));
        assertEquals("abc", memberships.formatKey("abc"));
        assertThrows(IllegalArgumentException.class, () -> memberships.formatKey(3.5d));
    }

    @Test
    void testFormatKey_RendersIdClassInstanceInNotFound() {
        GenericRecordService<Membership, Membership, Map<String, Object>, MembershipId> memberships =
                new GenericRecordService<>(session, Membership.class);
        MembershipId key = new MembershipId();
        key.setTeamId("t1");
        key.setPlayerId(10L);

        NotFound thrown = assertThrows(NotFound.class, () -> memberships.update(key, Collections.emptyMap()));

        assertEquals("teamId:t1|playerId:10", thrown.getMessage());
        verify(session, never()).add(any());
    }

    @Test
    void testClose_ClosesOwnedSession() {
        players.close();

        verify(session).close();
    }
}
