package workforce.backend.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.gas.DefaultGasProvider;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * web3j access to the WorkforceLogger contract over JSON-RPC.
 */
public class Web3jLedgerGateway implements LedgerGateway {

    private static final Logger log = LoggerFactory.getLogger(Web3jLedgerGateway.class);

    private static final long RECEIPT_POLL_MS = 1000;
    private static final int RECEIPT_POLL_ATTEMPTS = 120;

    /** Custom errors of the contract, keyed by 4-byte selector */
    private static final Map<String, String> KNOWN_ERRORS = Map.of(
            selector("AlreadyRegistered(address)"), "AlreadyRegistered",
            selector("NotRegisteredOrg(address)"), "NotRegisteredOrg");

    private final Web3j web3j;
    private final Credentials credentials;
    private final String contractAddress;
    private final TransactionManager txManager;
    private final TransactionReceiptProcessor receiptProcessor;

    public Web3jLedgerGateway(LedgerSettings settings) {
        this.web3j = Web3j.build(new HttpService(settings.rpcUrl()));
        this.credentials = Credentials.create(settings.privateKey());
        this.contractAddress = settings.contractAddress();
        this.txManager = settings.chainId() != null
                ? new RawTransactionManager(web3j, credentials, settings.chainId())
                : new RawTransactionManager(web3j, credentials);
        this.receiptProcessor = new PollingTransactionReceiptProcessor(web3j, RECEIPT_POLL_MS, RECEIPT_POLL_ATTEMPTS);

        log.info("Ledger gateway ready: contract={}, signer={}", contractAddress, credentials.getAddress());
    }

    @Override
    public String signerAddress() {
        return credentials.getAddress();
    }

    @Override
    public String logTaskCompletion(BigInteger taskId) throws LedgerCallException {
        Function function = new Function(
                "logTaskCompletion",
                List.<Type>of(new Uint256(taskId)),
                Collections.emptyList());
        return transact(function);
    }

    @Override
    public String registerOrg() throws LedgerCallException {
        Function function = new Function("registerOrg", Collections.emptyList(), Collections.emptyList());
        return transact(function);
    }

    @Override
    public boolean isRegistered(String address) throws LedgerCallException {
        Function function = new Function(
                "isRegistered",
                List.<Type>of(new Address(address)),
                List.<TypeReference<?>>of(new TypeReference<Bool>() {
                }));
        List<Type> result = call(function);
        return !result.isEmpty() && ((Bool) result.get(0)).getValue();
    }

    @Override
    public BigInteger totalLogged() throws LedgerCallException {
        Function function = new Function(
                "totalLogged",
                Collections.emptyList(),
                List.<TypeReference<?>>of(new TypeReference<Uint256>() {
                }));
        List<Type> result = call(function);
        if (result.isEmpty()) {
            throw new LedgerCallException("totalLogged returned no value");
        }
        return ((Uint256) result.get(0)).getValue();
    }

    @Override
    public void close() {
        web3j.shutdown();
    }

    private String transact(Function function) throws LedgerCallException {
        String data = FunctionEncoder.encode(function);
        try {
            EthSendTransaction sent = txManager.sendTransaction(
                    DefaultGasProvider.GAS_PRICE,
                    DefaultGasProvider.GAS_LIMIT,
                    contractAddress,
                    data,
                    BigInteger.ZERO);

            if (sent.hasError()) {
                String revertData = sent.getError().getData();
                throw new LedgerCallException(
                        describe(function.getName(), sent.getError().getMessage(), revertData), revertData, null);
            }

            TransactionReceipt receipt = receiptProcessor.waitForTransactionReceipt(sent.getTransactionHash());
            if (!receipt.isStatusOK()) {
                throw new LedgerCallException(
                        describe(function.getName(), "transaction reverted", receipt.getRevertReason()),
                        receipt.getRevertReason(), null);
            }
            return receipt.getTransactionHash();
        } catch (IOException | TransactionException e) {
            throw new LedgerCallException(function.getName() + " failed: " + e.getMessage(), e);
        }
    }

    private List<Type> call(Function function) throws LedgerCallException {
        String data = FunctionEncoder.encode(function);
        try {
            EthCall response = web3j.ethCall(
                    Transaction.createEthCallTransaction(credentials.getAddress(), contractAddress, data),
                    DefaultBlockParameterName.LATEST).send();

            if (response.hasError()) {
                throw new LedgerCallException(function.getName() + " failed: " + response.getError().getMessage());
            }
            if (response.isReverted()) {
                throw new LedgerCallException(function.getName() + " reverted: " + response.getRevertReason());
            }
            return FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
        } catch (IOException e) {
            throw new LedgerCallException(function.getName() + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Node error text, with the custom error name appended when the revert data matches one.
     */
    private static String describe(String functionName, String message, String revertData) {
        String text = functionName + " failed: " + message;
        if (revertData != null && revertData.length() >= 10) {
            String name = KNOWN_ERRORS.get(revertData.substring(0, 10).toLowerCase());
            if (name != null) {
                text += " (" + name + ")";
            }
        }
        return text;
    }

    private static String selector(String signature) {
        return Hash.sha3String(signature).substring(0, 10);
    }
}
