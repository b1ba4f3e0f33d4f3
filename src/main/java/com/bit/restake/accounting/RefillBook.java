package com.bit.restake.accounting;

import com.bit.restake.common.Address;
import com.bit.restake.structure.dto.RefillTicket;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 未完成的缓冲回补凭证，按 "委托地址:取回ID" 登记
 * 调用方持有全局账本锁
 */
@Component
public class RefillBook {

    private final Map<String, RefillTicket> tickets = new LinkedHashMap<>();

    public void put(RefillTicket ticket) {
        tickets.put(key(ticket.getDelegate(), ticket.getRequestId()), ticket);
    }

    public RefillTicket get(Address delegate, long requestId) {
        return tickets.get(key(delegate, requestId));
    }

    public void remove(Address delegate, long requestId) {
        tickets.remove(key(delegate, requestId));
    }

    public List<RefillTicket> list() {
        List<RefillTicket> copies = new ArrayList<>(tickets.size());
        tickets.values().forEach(t -> copies.add(t.copy()));
        return copies;
    }

    /**
     * 已从池取出、还停在核心地址上的凭证
     */
    public List<RefillTicket> received() {
        List<RefillTicket> result = new ArrayList<>();
        for (RefillTicket ticket : tickets.values()) {
            if (ticket.hasProceeds()) {
                result.add(ticket);
            }
        }
        return result;
    }

    public static String key(Address delegate, long requestId) {
        return delegate.toHex() + ":" + requestId;
    }
}
