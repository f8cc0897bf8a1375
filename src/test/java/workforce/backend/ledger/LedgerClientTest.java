package workforce.backend.ledger;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LedgerClientTest {

    private static final String TASK_ID = "550e8400-e29b-41d4-a716-446655440000";

    @Test
    void missingSettingsGiveDisabledClient() {
        LedgerClient client = LedgerClient.create(new LedgerSettings("http://localhost:8545", null, "0xabc", null));

        assertFalse(client.isEnabled());
        assertInstanceOf(DisabledLedgerClient.class, client);
        assertEquals(Optional.empty(), client.recordCompletion(TASK_ID));
        assertEquals(Optional.empty(), client.registerTenant());
        assertFalse(client.isRegistered("0xabc"));
        assertEquals(Optional.empty(), client.totalLogged());
        assertEquals(Optional.empty(), client.signerAddress());
    }

    @Test
    void nullSettingsGiveDisabledClient() {
        assertFalse(LedgerClient.create(null).isEnabled());
        assertFalse(LedgerClient.create(LedgerSettings.none()).isEnabled());
    }

    @Test
    void missingNamesAreTheEnvironmentVariables() {
        assertEquals(List.of("WEB3_RPC_URL", "DEPLOYER_PRIVATE_KEY", "WORKFORCE_LOGGER_ADDRESS"),
                LedgerSettings.none().missing());
        assertEquals(List.of("DEPLOYER_PRIVATE_KEY"),
                new LedgerSettings("http://rpc", " ", "0xabc", null).missing());
        assertTrue(new LedgerSettings("http://rpc", "0x01", "0xabc", 31337L).isComplete());
    }

    @Test
    void settingsNeverPrintTheKey() {
        String text = new LedgerSettings("http://rpc", "0xsecretkey", "0xabc", null).toString();

        assertFalse(text.contains("0xsecretkey"));
        assertTrue(text.contains("privateKeySet=true"));
    }

    @Test
    void recordCompletionSendsNumericTaskId() {
        FakeGateway gateway = new FakeGateway();
        LedgerClient client = new Web3LedgerClient(gateway);

        Optional<String> tx = client.recordCompletion(TASK_ID);

        assertEquals(Optional.of("0xtx1"), tx);
        assertEquals(List.of(LedgerIds.toUint256(TASK_ID)), gateway.logged);
        assertTrue(client.isEnabled());
    }

    @Test
    void recordCompletionNeverThrows() {
        FakeGateway gateway = new FakeGateway();
        gateway.failure = new LedgerCallException("execution reverted: NotRegistered");
        LedgerClient client = new Web3LedgerClient(gateway);

        assertEquals(Optional.empty(), client.recordCompletion(TASK_ID));

        gateway.failure = null;
        gateway.runtimeFailure = new IllegalStateException("connection refused");
        assertEquals(Optional.empty(), client.recordCompletion(TASK_ID));

        // Not a UUID: rejected before any call
        gateway.runtimeFailure = null;
        assertEquals(Optional.empty(), client.recordCompletion("task-42"));
        assertTrue(gateway.logged.isEmpty());
    }

    @Test
    void alreadyRegisteredIsNotAnError() {
        FakeGateway gateway = new FakeGateway();
        gateway.failure = new LedgerCallException("execution reverted (custom error AlreadyRegistered)");
        LedgerClient client = new Web3LedgerClient(gateway);

        assertEquals(Optional.empty(), client.registerTenant());
        assertEquals(1, gateway.registerCalls);
    }

    @Test
    void registerTenantReturnsTransaction() {
        FakeGateway gateway = new FakeGateway();
        LedgerClient client = new Web3LedgerClient(gateway);

        assertEquals(Optional.of("0xregister"), client.registerTenant());
    }

    @Test
    void readsDegradeOnErrors() {
        FakeGateway gateway = new FakeGateway();
        LedgerClient client = new Web3LedgerClient(gateway);

        assertTrue(client.isRegistered("0xsigner"));
        assertEquals(Optional.of(BigInteger.valueOf(7)), client.totalLogged());
        assertEquals(Optional.of("0xsigner"), client.signerAddress());

        gateway.failure = new LedgerCallException("timeout");
        assertFalse(client.isRegistered("0xsigner"));
        assertEquals(Optional.empty(), client.totalLogged());
    }

    @Test
    void closeReleasesGateway() {
        FakeGateway gateway = new FakeGateway();
        new Web3LedgerClient(gateway).close();

        assertTrue(gateway.closed);
    }

    private static final class FakeGateway implements LedgerGateway {
        final List<BigInteger> logged = new ArrayList<>();
        LedgerCallException failure;
        RuntimeException runtimeFailure;
        int registerCalls;
        boolean closed;

        private void maybeFail() throws LedgerCallException {
            if (failure != null) {
                throw failure;
            }
            if (runtimeFailure != null) {
                throw runtimeFailure;
            }
        }

        @Override
        public String signerAddress() {
            return "0xsigner";
        }

        @Override
        public String logTaskCompletion(BigInteger taskId) throws LedgerCallException {
            maybeFail();
            logged.add(taskId);
            return "0xtx" + logged.size();
        }

        @Override
        public String registerOrg() throws LedgerCallException {
            registerCalls++;
            maybeFail();
            return "0xregister";
        }

        @Override
        public boolean isRegistered(String address) throws LedgerCallException {
            maybeFail();
            return true;
        }

        @Override
        public BigInteger totalLogged() throws LedgerCallException {
            maybeFail();
            return BigInteger.valueOf(7);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
