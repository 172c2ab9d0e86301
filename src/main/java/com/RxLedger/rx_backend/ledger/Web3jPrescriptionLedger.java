package com.RxLedger.rx_backend.ledger;

import com.RxLedger.rx_backend.enums.OnChainStatus;
import com.RxLedger.rx_backend.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.EventValues;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.Contract;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.gas.DefaultGasProvider;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Prescription ledger backed by the registry contract on an EVM node.
 * <p>
 * Expected contract surface:
 * <pre>
 * function getPrescription(bytes32 id) view returns (bytes32 id, address issuer, bytes32 patientHash,
 *     bytes32 medicationHash, uint256 quantity, uint256 expiryDate, uint256 maxUsage, uint256 usageCount, uint8 status)
 * function issuePrescription(bytes32 id, bytes32 patientHash, bytes32 medicationHash, uint256 quantity,
 *     uint256 expiryDate, uint256 maxUsage)
 * function dispensePrescription(bytes32 id)
 * function registerDoctor(address) / registerPharmacy(address)
 * function doctors(address) view returns (bool) / pharmacies(address) view returns (bool)
 * event PrescriptionCreated(bytes32 indexed id, address indexed issuer, bytes32 medicationHash)
 * event PrescriptionDispensed(bytes32 indexed id, address indexed pharmacy, uint256 remainingUsage)
 * event PrescriptionExpired(bytes32 indexed id)
 * </pre>
 * HTTP timeouts are configured on the {@link Web3j} client handed in.
 */
@Slf4j
public class Web3jPrescriptionLedger implements PrescriptionLedger {

    static final Event PRESCRIPTION_CREATED = new Event("PrescriptionCreated", Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>(true) {
            },
            new TypeReference<Address>(true) {
            },
            new TypeReference<Bytes32>() {
            }));

    static final Event PRESCRIPTION_DISPENSED = new Event("PrescriptionDispensed", Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>(true) {
            },
            new TypeReference<Address>(true) {
            },
            new TypeReference<Uint256>() {
            }));

    static final Event PRESCRIPTION_EXPIRED = new Event("PrescriptionExpired", Collections.<TypeReference<?>>singletonList(
            new TypeReference<Bytes32>(true) {
            }));

    private static final String CREATED_TOPIC = EventEncoder.encode(PRESCRIPTION_CREATED);
    private static final String DISPENSED_TOPIC = EventEncoder.encode(PRESCRIPTION_DISPENSED);
    private static final String EXPIRED_TOPIC = EventEncoder.encode(PRESCRIPTION_EXPIRED);

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
    private static final String REVERT_PREFIX = "execution reverted: ";
    private static final long RECEIPT_POLL_INTERVAL_MS = 1000L;
    private static final int RECEIPT_POLL_ATTEMPTS = 40;

    private final Web3j web3j;
    private final String contractAddress;
    private final String signerAddress;
    private final TransactionManager transactionManager;
    private final TransactionReceiptProcessor receiptProcessor;

    public Web3jPrescriptionLedger(Web3j web3j, String contractAddress, Credentials credentials, long chainId) {
        this.web3j = web3j;
        this.contractAddress = contractAddress;
        if (credentials != null) {
            this.signerAddress = credentials.getAddress().toLowerCase(Locale.ROOT);
            this.transactionManager = new RawTransactionManager(web3j, credentials, chainId);
        } else {
            this.signerAddress = null;
            this.transactionManager = null;
        }
        this.receiptProcessor = new PollingTransactionReceiptProcessor(web3j, RECEIPT_POLL_INTERVAL_MS, RECEIPT_POLL_ATTEMPTS);
    }

    @Override
    public long blockNumber() {
        EthBlockNumber response;
        try {
            response = web3j.ethBlockNumber().send();
        } catch (IOException e) {
            throw new LedgerException("Ledger RPC unreachable: " + e.getMessage(), e);
        }
        if (response.hasError()) {
            throw new LedgerException("eth_blockNumber failed: " + response.getError().getMessage(), HttpStatus.SERVICE_UNAVAILABLE);
        }
        return response.getBlockNumber().longValue();
    }

    @Override
    public LedgerPrescription getPrescription(String prescriptionId) {
        Function function = new Function("getPrescription",
                Collections.<Type>singletonList(new Bytes32(Numeric.hexStringToByteArray(prescriptionId))),
                Arrays.<TypeReference<?>>asList(
                        new TypeReference<Bytes32>() {
                        },
                        new TypeReference<Address>() {
                        },
                        new TypeReference<Bytes32>() {
                        },
                        new TypeReference<Bytes32>() {
                        },
                        new TypeReference<Uint256>() {
                        },
                        new TypeReference<Uint256>() {
                        },
                        new TypeReference<Uint256>() {
                        },
                        new TypeReference<Uint256>() {
                        },
                        new TypeReference<Uint8>() {
                        }));

        List<Type> values = call(function);
        if (values.size() != 9) {
            throw new LedgerException("Unexpected getPrescription response from " + contractAddress, HttpStatus.SERVICE_UNAVAILABLE);
        }
        return LedgerPrescription.builder()
                .id(Numeric.toHexString(((Bytes32) values.get(0)).getValue()))
                .issuer(values.get(1).toString().toLowerCase(Locale.ROOT))
                .patientHash(Numeric.toHexString(((Bytes32) values.get(2)).getValue()))
                .medicationHash(Numeric.toHexString(((Bytes32) values.get(3)).getValue()))
                .quantity(toLong((Uint256) values.get(4), "quantity"))
                .expiryDate(toLong((Uint256) values.get(5), "expiryDate"))
                .maxUsage(toLong((Uint256) values.get(6), "maxUsage"))
                .usageCount(toLong((Uint256) values.get(7), "usageCount"))
                .status(OnChainStatus.fromCode(((Uint8) values.get(8)).getValue().intValue()))
                .build();
    }

    @Override
    public LedgerReceipt issuePrescription(String caller, IssueCommand command) {
        Function function = new Function("issuePrescription",
                Arrays.<Type>asList(
                        new Bytes32(Numeric.hexStringToByteArray(command.getPrescriptionId())),
                        new Bytes32(Numeric.hexStringToByteArray(command.getPatientHash())),
                        new Bytes32(Numeric.hexStringToByteArray(command.getMedicationHash())),
                        new Uint256(command.getQuantity()),
                        new Uint256(command.getExpiryDate()),
                        new Uint256(command.getMaxUsage())),
                Collections.<TypeReference<?>>emptyList());
        return submit(caller, function);
    }

    @Override
    public LedgerReceipt dispensePrescription(String caller, String prescriptionId) {
        Function function = new Function("dispensePrescription",
                Collections.<Type>singletonList(new Bytes32(Numeric.hexStringToByteArray(prescriptionId))),
                Collections.<TypeReference<?>>emptyList());
        return submit(caller, function);
    }

    @Override
    public LedgerReceipt registerDoctor(String caller, String doctor) {
        return submit(caller, roleGrant("registerDoctor", doctor));
    }

    @Override
    public LedgerReceipt registerPharmacy(String caller, String pharmacy) {
        return submit(caller, roleGrant("registerPharmacy", pharmacy));
    }

    @Override
    public boolean isDoctor(String address) {
        return roleLookup("doctors", address);
    }

    @Override
    public boolean isPharmacy(String address) {
        return roleLookup("pharmacies", address);
    }

    @Override
    public String adminAddress() {
        return signerAddress;
    }

    private Function roleGrant(String name, String address) {
        return new Function(name,
                Collections.<Type>singletonList(new Address(address)),
                Collections.<TypeReference<?>>emptyList());
    }

    private boolean roleLookup(String name, String address) {
        Function function = new Function(name,
                Collections.<Type>singletonList(new Address(address)),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Bool>() {
                }));
        List<Type> values = call(function);
        return !values.isEmpty() && ((Bool) values.get(0)).getValue();
    }

    private List<Type> call(Function function) {
        String data = FunctionEncoder.encode(function);
        EthCall response = ethCall(data, signerAddress != null ? signerAddress : ZERO_ADDRESS, function.getName());
        return FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
    }

    private EthCall ethCall(String data, String from, String method) {
        EthCall response;
        try {
            response = web3j.ethCall(
                    Transaction.createEthCallTransaction(from, contractAddress, data),
                    DefaultBlockParameterName.LATEST).send();
        } catch (IOException e) {
            throw new LedgerException("Ledger call " + method + " failed: " + e.getMessage(), e);
        }
        if (response.isReverted()) {
            throw LedgerException.reverted(stripRevertPrefix(response.getRevertReason()));
        }
        if (response.hasError()) {
            throw LedgerException.reverted(stripRevertPrefix(response.getError().getMessage()));
        }
        return response;
    }

    private LedgerReceipt submit(String caller, Function function) {
        if (transactionManager == null) {
            throw new LedgerException("No signing key configured for ledger submissions", HttpStatus.SERVICE_UNAVAILABLE);
        }
        if (caller == null || !signerAddress.equalsIgnoreCase(caller)) {
            throw new LedgerException("Ledger signer " + signerAddress + " cannot act for " + caller, HttpStatus.FORBIDDEN);
        }

        String data = FunctionEncoder.encode(function);
        // dry run first so a revert comes back with its reason instead of a failed receipt
        ethCall(data, signerAddress, function.getName());

        EthSendTransaction sent;
        try {
            sent = transactionManager.sendTransaction(
                    DefaultGasProvider.GAS_PRICE, DefaultGasProvider.GAS_LIMIT, contractAddress, data, BigInteger.ZERO);
        } catch (IOException e) {
            throw new LedgerException("Ledger submit " + function.getName() + " failed: " + e.getMessage(), e);
        }
        if (sent.hasError()) {
            throw LedgerException.reverted(stripRevertPrefix(sent.getError().getMessage()));
        }

        TransactionReceipt receipt;
        try {
            receipt = receiptProcessor.waitForTransactionReceipt(sent.getTransactionHash());
        } catch (IOException | TransactionException e) {
            throw new LedgerException("No receipt for " + function.getName() + " tx " + sent.getTransactionHash()
                    + ": " + e.getMessage(), e);
        }
        if (!receipt.isStatusOK()) {
            String reason = receipt.getRevertReason();
            throw LedgerException.reverted(reason != null ? stripRevertPrefix(reason) : "Transaction reverted");
        }

        log.info("Ledger tx {} mined: {} in block {}", function.getName(), receipt.getTransactionHash(), receipt.getBlockNumber());
        return LedgerReceipt.builder()
                .transactionHash(receipt.getTransactionHash())
                .blockNumber(receipt.getBlockNumber().longValue())
                .events(decodeEvents(receipt.getLogs()))
                .build();
    }

    List<LedgerEvent> decodeEvents(List<Log> logs) {
        List<LedgerEvent> events = new ArrayList<>();
        if (logs == null) {
            return events;
        }
        for (Log entry : logs) {
            if (entry.getTopics() == null || entry.getTopics().isEmpty()
                    || !contractAddress.equalsIgnoreCase(entry.getAddress())) {
                continue;
            }
            String topic = entry.getTopics().get(0);
            if (CREATED_TOPIC.equals(topic)) {
                EventValues values = Contract.staticExtractEventParameters(PRESCRIPTION_CREATED, entry);
                events.add(LedgerEvent.builder()
                        .type(LedgerEvent.Type.PRESCRIPTION_CREATED)
                        .prescriptionId(Numeric.toHexString(((Bytes32) values.getIndexedValues().get(0)).getValue()))
                        .actor(values.getIndexedValues().get(1).toString().toLowerCase(Locale.ROOT))
                        .medicationHash(Numeric.toHexString(((Bytes32) values.getNonIndexedValues().get(0)).getValue()))
                        .build());
            } else if (DISPENSED_TOPIC.equals(topic)) {
                EventValues values = Contract.staticExtractEventParameters(PRESCRIPTION_DISPENSED, entry);
                events.add(LedgerEvent.builder()
                        .type(LedgerEvent.Type.PRESCRIPTION_DISPENSED)
                        .prescriptionId(Numeric.toHexString(((Bytes32) values.getIndexedValues().get(0)).getValue()))
                        .actor(values.getIndexedValues().get(1).toString().toLowerCase(Locale.ROOT))
                        .remainingUsage(toLong((Uint256) values.getNonIndexedValues().get(0), "remainingUsage"))
                        .build());
            } else if (EXPIRED_TOPIC.equals(topic)) {
                EventValues values = Contract.staticExtractEventParameters(PRESCRIPTION_EXPIRED, entry);
                events.add(LedgerEvent.builder()
                        .type(LedgerEvent.Type.PRESCRIPTION_EXPIRED)
                        .prescriptionId(Numeric.toHexString(((Bytes32) values.getIndexedValues().get(0)).getValue()))
                        .build());
            }
        }
        return events;
    }

    static long toLong(Uint256 value, String field) {
        try {
            return value.getValue().longValueExact();
        } catch (ArithmeticException e) {
            throw new LedgerException("Ledger value " + field + "=" + value.getValue() + " does not fit in 64 bits",
                    HttpStatus.BAD_GATEWAY);
        }
    }

    static String stripRevertPrefix(String message) {
        if (message == null) {
            return "Transaction reverted";
        }
        int index = message.indexOf(REVERT_PREFIX);
        return index >= 0 ? message.substring(index + REVERT_PREFIX.length()).trim() : message;
    }
}
