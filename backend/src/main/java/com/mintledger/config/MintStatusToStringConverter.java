package com.mintledger.config;

import com.mintledger.domain.MintStatus;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

/**
 * Writes MintStatus as its lowercase value, the form already present in the nfts collection.
 */
@WritingConverter
public class MintStatusToStringConverter implements Converter<MintStatus, String> {

    @Override
    public String convert(MintStatus source) {
        return source.value();
    }
}
