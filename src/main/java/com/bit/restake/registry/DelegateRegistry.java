package com.bit.restake.registry;

import com.bit.restake.common.Address;
import com.bit.restake.structure.delegate.OperatorDelegate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 运营商委托列表，插入顺序是默认选择的依据
 */
@Component
public class DelegateRegistry {

    private final IndexedRegistry<Address, OperatorDelegate> delegates = new IndexedRegistry<>("operator delegate");

    public void add(OperatorDelegate delegate) {
        delegates.add(delegate.getAddress(), delegate);
    }

    public OperatorDelegate remove(Address delegate) {
        return delegates.remove(delegate);
    }

    public boolean contains(Address delegate) {
        return delegates.contains(delegate);
    }

    public OperatorDelegate get(Address delegate) {
        return delegates.get(delegate);
    }

    public OperatorDelegate get(int index) {
        return delegates.get(index);
    }

    public int indexOf(Address delegate) {
        return delegates.indexOf(delegate);
    }

    public int size() {
        return delegates.size();
    }

    public boolean isEmpty() {
        return delegates.isEmpty();
    }

    public List<OperatorDelegate> list() {
        return delegates.values();
    }
}
