package com.work.bundler.core.chain.web3j;

import com.work.bundler.core.model.UserOperation;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.DynamicStruct;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * EntryPoint v0.6 的 ABI 编解码（只覆盖 bundler 用到的方法与错误）。
 */
final class EntryPointAbi {

    static final String USER_OP_TUPLE =
            "(address,uint256,bytes,bytes,uint256,uint256,uint256,uint256,uint256,bytes,bytes)";

    static final String HANDLE_OPS = FunctionEncoder.buildMethodId("handleOps(" + USER_OP_TUPLE + "[],address)");
    static final String SIMULATE_VALIDATION = FunctionEncoder.buildMethodId("simulateValidation(" + USER_OP_TUPLE + ")");

    static final String FAILED_OP = FunctionEncoder.buildMethodId("FailedOp(uint256,string)");
    static final String ERROR_STRING = FunctionEncoder.buildMethodId("Error(string)");
    static final String VALIDATION_RESULT = FunctionEncoder.buildMethodId(
            "ValidationResult((uint256,uint256,bool,uint48,uint48,bytes),(uint256,uint256),(uint256,uint256),(uint256,uint256))");
    static final String VALIDATION_RESULT_WITH_AGGREGATION = FunctionEncoder.buildMethodId(
            "ValidationResultWithAggregation((uint256,uint256,bool,uint48,uint48,bytes),(uint256,uint256),"
                    + "(uint256,uint256),(uint256,uint256),(address,(uint256,uint256)))");

    private static final int SELECTOR_HEX = 10;
    private static final int WORD_HEX = 64;

    private EntryPointAbi() {
    }

    /**
     * UserOperation 的 tuple 形态（含 bytes 字段，属于动态 struct）。
     */
    static class UserOperationStruct extends DynamicStruct {
        UserOperationStruct(UserOperation op) {
            super(new Address(op.getSender()),
                    new Uint256(op.getNonce()),
                    new DynamicBytes(Numeric.hexStringToByteArray(op.getInitCode())),
                    new DynamicBytes(Numeric.hexStringToByteArray(op.getCallData())),
                    new Uint256(op.getCallGasLimit()),
                    new Uint256(op.getVerificationGasLimit()),
                    new Uint256(op.getPreVerificationGas()),
                    new Uint256(op.getMaxFeePerGas()),
                    new Uint256(op.getMaxPriorityFeePerGas()),
                    new DynamicBytes(Numeric.hexStringToByteArray(op.getPaymasterAndData())),
                    new DynamicBytes(Numeric.hexStringToByteArray(op.getSignature())));
        }
    }

    static String encodeHandleOps(List<UserOperation> ops, String beneficiary) {
        List<UserOperationStruct> structs = new ArrayList<>(ops.size());
        for (UserOperation op : ops) {
            structs.add(new UserOperationStruct(op));
        }
        List<Type> params = Arrays.<Type>asList(
                new DynamicArray<>(UserOperationStruct.class, structs),
                new Address(beneficiary));
        return HANDLE_OPS + FunctionEncoder.encodeConstructor(params);
    }

    static String encodeSimulateValidation(UserOperation op) {
        List<Type> params = Collections.<Type>singletonList(new UserOperationStruct(op));
        return SIMULATE_VALIDATION + FunctionEncoder.encodeConstructor(params);
    }

    /**
     * 从 ValidationResult 的 returnInfo 中取 sigFailed，转换为 validationData（0 通过，1 签名失败）。
     * 返回 null 表示数据不是 ValidationResult。
     */
    static BigInteger decodeValidationData(String hex) {
        if (hex == null || hex.length() < SELECTOR_HEX) {
            return null;
        }
        String selector = hex.substring(0, SELECTOR_HEX).toLowerCase();
        if (!selector.equals(VALIDATION_RESULT) && !selector.equals(VALIDATION_RESULT_WITH_AGGREGATION)) {
            return null;
        }
        String body = hex.substring(SELECTOR_HEX);
        // 第一个参数是动态 tuple：先读偏移，再读 tuple 内第 3 个字段 sigFailed
        int offsetWords = word(body, 0).intValue() / 32;
        BigInteger sigFailed = word(body, offsetWords + 2);
        return sigFailed.signum() == 0 ? BigInteger.ZERO : BigInteger.ONE;
    }

    /**
     * 解析 FailedOp / Error(string) 的原因文本；无法识别时返回 null。
     */
    static String decodeRevertReason(String hex) {
        if (hex == null || hex.length() < SELECTOR_HEX) {
            return null;
        }
        String selector = hex.substring(0, SELECTOR_HEX).toLowerCase();
        String body = hex.substring(SELECTOR_HEX);
        if (selector.equals(FAILED_OP)) {
            List<Type> values = FunctionReturnDecoder.decode(body, Utils.convert(Arrays.<TypeReference<?>>asList(
                    new TypeReference<Uint256>() {
                    },
                    new TypeReference<Utf8String>() {
                    })));
            return values.size() == 2 ? (String) values.get(1).getValue() : null;
        }
        if (selector.equals(ERROR_STRING)) {
            List<Type> values = FunctionReturnDecoder.decode(body, Utils.convert(Collections.<TypeReference<?>>singletonList(
                    new TypeReference<Utf8String>() {
                    })));
            return values.isEmpty() ? null : (String) values.get(0).getValue();
        }
        return null;
    }

    private static BigInteger word(String body, int index) {
        int from = index * WORD_HEX;
        if (body.length() < from + WORD_HEX) {
            throw new IllegalArgumentException("truncated abi data");
        }
        return new BigInteger(body.substring(from, from + WORD_HEX), 16);
    }
}
