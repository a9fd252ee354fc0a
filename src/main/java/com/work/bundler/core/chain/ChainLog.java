package com.work.bundler.core.chain;

import java.util.ArrayList;
import java.util.List;

/**
 * 交易回执中的单条日志（与 eth_getTransactionReceipt 的 logs 元素对应）。
 */
public class ChainLog {

    private String address;
    private List<String> topics = new ArrayList<>();
    private String data;
    private String logIndex;

    public ChainLog() {
    }

    public ChainLog(String address, List<String> topics, String data, String logIndex) {
        this.address = address;
        this.topics = topics == null ? new ArrayList<>() : new ArrayList<>(topics);
        this.data = data;
        this.logIndex = logIndex;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public List<String> getTopics() {
        return topics;
    }

    public void setTopics(List<String> topics) {
        this.topics = topics;
    }

    public String getData() {
        return data;
    }

    public void setData(String data) {
        this.data = data;
    }

    public String getLogIndex() {
        return logIndex;
    }

    public void setLogIndex(String logIndex) {
        this.logIndex = logIndex;
    }
}
