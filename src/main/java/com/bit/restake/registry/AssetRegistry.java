package com.bit.restake.registry;

import com.bit.restake.common.Address;
import com.bit.restake.structure.asset.CollateralAsset;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 已注册抵押资产，顺序即 TVL 矩阵中的列号
 */
@Component
public class AssetRegistry {

    private final IndexedRegistry<Address, CollateralAsset> assets = new IndexedRegistry<>("collateral asset");

    public void add(CollateralAsset asset) {
        assets.add(asset.getAddress(), asset);
    }

    public CollateralAsset remove(Address asset) {
        return assets.remove(asset);
    }

    public boolean contains(Address asset) {
        return assets.contains(asset);
    }

    public CollateralAsset get(Address asset) {
        return assets.get(asset);
    }

    public int indexOf(Address asset) {
        return assets.indexOf(asset);
    }

    public CollateralAsset get(int index) {
        return assets.get(index);
    }

    public int size() {
        return assets.size();
    }

    public List<CollateralAsset> list() {
        return assets.values();
    }

    public List<Address> addresses() {
        return assets.keys();
    }
}
