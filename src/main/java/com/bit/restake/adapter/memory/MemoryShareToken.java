package com.bit.restake.adapter.memory;

import com.bit.restake.common.Address;
import com.bit.restake.token.ShareToken;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class MemoryShareToken implements ShareToken {

    private final Map<Address, BigInteger> balances = new ConcurrentHashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    @Override
    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public BigInteger balanceOf(Address holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    @Override
    public synchronized void mint(Address to, BigInteger amount) {
        balances.merge(to, amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
    }

    @Override
    public synchronized void burn(Address from, BigInteger amount) {
        debit(from, amount);
        totalSupply = totalSupply.subtract(amount);
    }

    @Override
    public synchronized void transfer(Address from, Address to, BigInteger amount) {
        debit(from, amount);
        balances.merge(to, amount, BigInteger::add);
    }

    private void debit(Address holder, BigInteger amount) {
        BigInteger balance = balanceOf(holder);
        if (balance.compareTo(amount) < 0) {
            throw new IllegalStateException("份额不足 holder=" + holder + " balance=" + balance + " amount=" + amount);
        }
        balances.put(holder, balance.subtract(amount));
    }
}
