package com.morket.replication.buffer;

import com.morket.replication.channel.ReplicationChannel;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 채널별 버퍼 묶음
 * 서비스 인스턴스가 소유하며 채널끼리는 서로 잠그지 않음
 */
@Component
public class ChannelBuffers {

    private final Map<ReplicationChannel, ChannelBuffer> buffers = new EnumMap<>(ReplicationChannel.class);

    public ChannelBuffers() {
        for (ReplicationChannel channel : ReplicationChannel.values()) {
            buffers.put(channel, new ChannelBuffer());
        }
    }

    /**
     * 이벤트 적재
     *
     * @return 적재 후 전체 채널 합계
     */
    public int append(BufferedEvent event) {
        buffers.get(event.channel()).append(event);
        return totalSize();
    }

    public List<BufferedEvent> drain(ReplicationChannel channel) {
        return buffers.get(channel).drain();
    }

    public int size(ReplicationChannel channel) {
        return buffers.get(channel).size();
    }

    public int totalSize() {
        int total = 0;
        for (ChannelBuffer buffer : buffers.values()) {
            total += buffer.size();
        }
        return total;
    }

    public boolean isEmpty() {
        return totalSize() == 0;
    }
}
