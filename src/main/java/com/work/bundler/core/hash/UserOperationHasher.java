package com.work.bundler.core.hash;

import com.work.bundler.core.model.UserOperation;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * userOpHash 计算：纯函数，无 I/O、无随机、无时间依赖。
 *
 * inner = keccak256(abi.encode(sender, nonce, initCode, callData, callGasLimit, verificationGasLimit,
 *                              preVerificationGas, maxFeePerGas, maxPriorityFeePerGas, paymasterAndData, signature))
 * hash  = keccak256(abi.encode(entryPoint, chainId, inner))
 *
 * 外层绑定 entryPoint 与 chainId，防止跨部署/跨链重放。
 */
public class UserOperationHasher {

    public String hash(UserOperation op, String entryPoint, long chainId) {
        byte[] inner = Hash.sha3(Numeric.hexStringToByteArray(encodeFields(op)));
        List<Type> outer = Arrays.<Type>asList(
                new Address(entryPoint),
                new Uint256(BigInteger.valueOf(chainId)),
                new Bytes32(inner));
        byte[] digest = Hash.sha3(Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(outer)));
        return Numeric.toHexString(digest);
    }

    // 字段顺序与 EntryPoint 约定一致，不能调整
    String encodeFields(UserOperation op) {
        List<Type> fields = Arrays.<Type>asList(
                new Address(op.getSender()),
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
        return FunctionEncoder.encodeConstructor(fields);
    }
}
