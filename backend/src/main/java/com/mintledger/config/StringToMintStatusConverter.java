package com.mintledger.config;

import com.mintledger.domain.MintStatus;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

/**
 * Reads a stored status string as MintStatus, ignoring case.
 */
@ReadingConverter
public class StringToMintStatusConverter implements Converter<String, MintStatus> {

    @Override
    public MintStatus convert(String source) {
        return MintStatus.fromValue(source);
    }
}
