package com.work.bundler.core.chain;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * EntryPoint 的 UserOperationEvent 日志：
 * UserOperationEvent(bytes32 indexed userOpHash, address indexed sender, address indexed paymaster,
 * uint256 nonce, bool success, uint256 actualGasCost, uint256 actualGasUsed)
 */
public class UserOperationEvent {

    public static final String TOPIC = Hash.sha3String(
            "UserOperationEvent(bytes32,address,address,uint256,bool,uint256,uint256)");

    private static final int WORD_HEX = 64;
    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]*");

    private final String userOpHash;
    private final String sender;
    private final String paymaster;
    private final BigInteger nonce;
    private final boolean success;
    private final BigInteger actualGasCost;
    private final BigInteger actualGasUsed;

    public UserOperationEvent(String userOpHash, String sender, String paymaster, BigInteger nonce,
                              boolean success, BigInteger actualGasCost, BigInteger actualGasUsed) {
        this.userOpHash = userOpHash;
        this.sender = sender;
        this.paymaster = paymaster;
        this.nonce = nonce;
        this.success = success;
        this.actualGasCost = actualGasCost;
        this.actualGasUsed = actualGasUsed;
    }

    /**
     * 解析一条日志；不是 UserOperationEvent 或格式不完整时返回 empty。
     */
    public static Optional<UserOperationEvent> decode(ChainLog log) {
        if (log == null || log.getTopics() == null || log.getTopics().size() < 4) {
            return Optional.empty();
        }
        List<String> topics = log.getTopics();
        if (!TOPIC.equalsIgnoreCase(topics.get(0))) {
            return Optional.empty();
        }
        for (int i = 1; i < 4; i++) {
            if (!isWord(topics.get(i))) {
                return Optional.empty();
            }
        }
        String data = Numeric.cleanHexPrefix(log.getData() == null ? "" : log.getData());
        if (data.length() < WORD_HEX * 4 || !HEX.matcher(data).matches()) {
            return Optional.empty();
        }
        return Optional.of(new UserOperationEvent(
                topics.get(1).toLowerCase(),
                topicToAddress(topics.get(2)),
                topicToAddress(topics.get(3)),
                word(data, 0),
                word(data, 1).signum() != 0,
                word(data, 2),
                word(data, 3)));
    }

    private static boolean isWord(String topic) {
        if (topic == null) {
            return false;
        }
        String clean = Numeric.cleanHexPrefix(topic);
        return clean.length() == WORD_HEX && HEX.matcher(clean).matches();
    }

    /**
     * 测试/模拟链使用：编码成与链上一致的日志形态。
     */
    public ChainLog toLog(String entryPoint, String logIndex) {
        String data = "0x" + pad(nonce) + pad(success ? BigInteger.ONE : BigInteger.ZERO)
                + pad(actualGasCost) + pad(actualGasUsed);
        return new ChainLog(entryPoint,
                List.of(TOPIC, userOpHash, addressToTopic(sender), addressToTopic(paymaster)),
                data, logIndex);
    }

    private static BigInteger word(String data, int index) {
        return new BigInteger(data.substring(index * WORD_HEX, (index + 1) * WORD_HEX), 16);
    }

    private static String topicToAddress(String topic) {
        String clean = Numeric.cleanHexPrefix(topic);
        return "0x" + clean.substring(clean.length() - 40).toLowerCase();
    }

    private static String addressToTopic(String address) {
        String clean = address == null ? "" : Numeric.cleanHexPrefix(address);
        return "0x" + Numeric.toHexStringNoPrefixZeroPadded(clean.isEmpty() ? BigInteger.ZERO : new BigInteger(clean, 16), WORD_HEX);
    }

    private static String pad(BigInteger value) {
        return Numeric.toHexStringNoPrefixZeroPadded(value, WORD_HEX);
    }

    public String getUserOpHash() {
        return userOpHash;
    }

    public String getSender() {
        return sender;
    }

    public String getPaymaster() {
        return paymaster;
    }

    public BigInteger getNonce() {
        return nonce;
    }

    public boolean isSuccess() {
        return success;
    }

    public BigInteger getActualGasCost() {
        return actualGasCost;
    }

    public BigInteger getActualGasUsed() {
        return actualGasUsed;
    }
}
