package com.morket.replication.buffer;

import java.util.ArrayList;
import java.util.List;

/**
 * 채널 하나의 수신 순서 보존 버퍼
 * <p>
 * append 는 리스트 끝에 추가만 하고, drain 은 현재 세대를 통째로 떼어내고 새 세대로 교체
 * drain 이후 들어온 이벤트는 새 세대에 쌓이므로 같은 이벤트가 두 번 drain 되지 않음
 */
public class ChannelBuffer {

    private List<BufferedEvent> generation = new ArrayList<>();

    public synchronized void append(BufferedEvent event) {
        generation.add(event);
    }

    public synchronized List<BufferedEvent> drain() {
        if (generation.isEmpty()) {
            return List.of();
        }
        List<BufferedEvent> drained = generation;
        generation = new ArrayList<>();
        return drained;
    }

    public synchronized int size() {
        return generation.size();
    }

    public synchronized boolean isEmpty() {
        return generation.isEmpty();
    }
}
