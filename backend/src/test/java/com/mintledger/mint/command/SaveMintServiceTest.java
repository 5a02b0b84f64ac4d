package com.mintledger.mint.command;

import com.mintledger.domain.MintRecord;
import com.mintledger.domain.MintRecordFixtures;
import com.mintledger.mint.error.MissingFieldsException;
import com.mintledger.mint.store.InsertOutcome;
import com.mintledger.mint.store.MintRecordStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SaveMintServiceTest {

    @Mock
    MintRecordStore store;

    @InjectMocks
    SaveMintService saveMintService;

    @Test
    @DisplayName("missing fields are reported exactly, before any store access")
    void missingFieldsNamedExactly() {
        SaveMintCommand command = new SaveMintCommand(
                MintRecordFixtures.WALLET, null, MintRecordFixtures.METADATA_URI, " ",
                MintRecordFixtures.CONTRACT, null, null, null, null, null, null);

        assertThatThrownBy(() -> saveMintService.save(command))
                .isInstanceOf(MissingFieldsException.class)
                .satisfies(e -> {
                    MissingFieldsException ex = (MissingFieldsException) e;
                    assertThat(ex.getMissing()).containsExactly("ipfsCid", "tokenId", "transactionHash");
                    assertThat(ex.getRequired()).containsExactlyElementsOf(SaveMintService.REQUIRED_FIELDS);
                });
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("defaults: image URL from CID, default event, mint time now, primary chain; analytics captured")
    void buildsRecordWithDefaults() {
        Instant now = Instant.parse("2025-08-01T00:00:00Z");

        MintRecord record = SaveMintService.toRecord(command(null, null), now);

        assertThat(record.getImageUrl()).isEqualTo("https://gateway.pinata.cloud/ipfs/" + MintRecordFixtures.CID);
        assertThat(record.getEventData().getEventName()).isEqualTo("Onchain Summer Lagos");
        assertThat(record.getEventData().getMintedAt()).isEqualTo(now);
        assertThat(record.getNetworkChainId()).isEqualTo(8453);
        assertThat(record.getUserAgent()).isEqualTo("jest");
        assertThat(record.getIpAddress()).isEqualTo("127.0.0.1");
    }

    @Test
    @DisplayName("supplied mint time and chain id are kept")
    void keepsSuppliedValues() {
        SaveMintCommand command = new SaveMintCommand(
                MintRecordFixtures.WALLET, MintRecordFixtures.CID, MintRecordFixtures.METADATA_URI, "7",
                MintRecordFixtures.CONTRACT, MintRecordFixtures.TX_HASH, "Onchain Summer Lagos",
                MintRecordFixtures.MINTED_AT, 84532, null, null);

        MintRecord record = SaveMintService.toRecord(command, Instant.now());

        assertThat(record.getEventData().getMintedAt()).isEqualTo(MintRecordFixtures.MINTED_AT);
        assertThat(record.getNetworkChainId()).isEqualTo(84532);
    }

    @Test
    @DisplayName("first mint: created record, count 1, first-mint flag set")
    void firstMint() {
        when(store.insertOrGetExisting(any(MintRecord.class)))
                .thenAnswer(inv -> InsertOutcome.created(((MintRecord) inv.getArgument(0)).normalize()));
        when(store.countByOwner(MintRecordFixtures.WALLET)).thenReturn(1L);

        SaveMintResult result = saveMintService.save(command(null, MintRecordFixtures.MINTED_AT));

        assertThat(result.alreadyRecorded()).isFalse();
        assertThat(result.userTotalMints()).isEqualTo(1L);
        assertThat(result.firstMint()).isTrue();
        assertThat(result.record().transactionHash()).isEqualTo(MintRecordFixtures.TX_HASH.toLowerCase());
    }

    @Test
    @DisplayName("replayed hash returns the stored record flagged as already recorded")
    void alreadyRecorded() {
        MintRecord existing = MintRecordFixtures.record().normalize();
        existing.setId("stored");
        existing.setTokenId("original");
        when(store.insertOrGetExisting(any(MintRecord.class))).thenReturn(InsertOutcome.existing(existing));
        when(store.countByOwner(MintRecordFixtures.WALLET)).thenReturn(3L);

        SaveMintResult result = saveMintService.save(command(null, null));

        assertThat(result.alreadyRecorded()).isTrue();
        assertThat(result.record().id()).isEqualTo("stored");
        assertThat(result.record().tokenId()).isEqualTo("original");
        assertThat(result.firstMint()).isFalse();
    }

    @Test
    @DisplayName("the record handed to the store carries the caller's analytics")
    void passesAnalyticsToStore() {
        when(store.insertOrGetExisting(any(MintRecord.class)))
                .thenAnswer(inv -> InsertOutcome.created(inv.getArgument(0)));
        when(store.countByOwner(MintRecordFixtures.WALLET)).thenReturn(2L);

        saveMintService.save(command(null, null));

        ArgumentCaptor<MintRecord> captor = ArgumentCaptor.forClass(MintRecord.class);
        verify(store).insertOrGetExisting(captor.capture());
        assertThat(captor.getValue().getUserAgent()).isEqualTo("jest");
    }

    private static SaveMintCommand command(String eventName, Instant mintedAt) {
        return new SaveMintCommand(
                MintRecordFixtures.WALLET,
                MintRecordFixtures.CID,
                MintRecordFixtures.METADATA_URI,
                "42",
                MintRecordFixtures.CONTRACT,
                MintRecordFixtures.TX_HASH,
                eventName,
                mintedAt,
                null,
                "jest",
                "127.0.0.1");
    }
}
