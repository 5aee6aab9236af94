package com.agrotrace.ledger.clock;

import org.junit.jupiter.api.Test;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthBlockNumber;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class Web3jBlockClockTest {

    @Test
    void readsBlockHeightAndNeverGoesBackwards() throws IOException {
        Web3j web3j = mock(Web3j.class);
        Request<?, EthBlockNumber> request = stubRequest(web3j);
        when(request.send()).thenReturn(blockNumber("0x20"), blockNumber("0x1f"), blockNumber("0x21"));

        Web3jBlockClock clock = new Web3jBlockClock(web3j);

        assertThat(clock.current()).isEqualTo(32);
        assertThat(clock.current()).isEqualTo(32);
        assertThat(clock.advance()).isEqualTo(33);
    }

    @Test
    void nodeErrorSurfacesAsChainClockException() throws IOException {
        Web3j web3j = mock(Web3j.class);
        Request<?, EthBlockNumber> request = stubRequest(web3j);
        EthBlockNumber failed = new EthBlockNumber();
        failed.setError(new Response.Error(-32000, "node syncing"));
        when(request.send()).thenReturn(failed);

        assertThatThrownBy(() -> new Web3jBlockClock(web3j).current())
                .isInstanceOf(Web3jBlockClock.ChainClockException.class)
                .hasMessageContaining("node syncing");
    }

    @Test
    void unreachableNodeSurfacesAsChainClockException() throws IOException {
        Web3j web3j = mock(Web3j.class);
        Request<?, EthBlockNumber> request = stubRequest(web3j);
        when(request.send()).thenThrow(new IOException("connection refused"));

        assertThatThrownBy(() -> new Web3jBlockClock(web3j).current())
                .isInstanceOf(Web3jBlockClock.ChainClockException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @SuppressWarnings("unchecked")
    private static Request<?, EthBlockNumber> stubRequest(Web3j web3j) {
        Request<?, EthBlockNumber> request = mock(Request.class);
        doReturn(request).when(web3j).ethBlockNumber();
        return request;
    }

    private static EthBlockNumber blockNumber(String hex) {
        EthBlockNumber response = new EthBlockNumber();
        response.setResult(hex);
        return response;
    }
}
