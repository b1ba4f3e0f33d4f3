package com.bit.restake.config;

import com.bit.restake.common.Address;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * 请求参数 / 请求头中的十六进制地址
 */
@Component
public class StringToAddressConverter implements Converter<String, Address> {

    @Override
    public Address convert(String source) {
        return Address.fromHex(source.trim());
    }
}
