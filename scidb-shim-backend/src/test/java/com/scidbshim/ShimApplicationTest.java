package com.scidbshim;

import com.scidbshim.abi.ErrorBuffer;
import com.scidbshim.abi.OpaqueRef;
import com.scidbshim.abi.ShimClientApi;
import com.scidbshim.client.ClientRegistry;
import com.scidbshim.model.QueryId;
import com.scidbshim.service.SessionHandle;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ShimApplicationTest {

    @Autowired
    private ShimClientApi api;

    @Autowired
    private ClientRegistry clientRegistry;

    @Test
    void contextWiresClientFromClasspath() {
        assertThat(clientRegistry.list()).extracting(ClientRegistry.Entry::getSource)
                .containsExactly(ClientRegistry.Source.CLASSPATH);

        OpaqueRef<SessionHandle> con = new OpaqueRef<>();
        assertThat(api.scidbConnect("localhost", 1239, null, null, false, con)).isZero();

        ErrorBuffer err = api.newErrorBuffer();
        QueryId id = api.executeQuery(con.get(), "list('arrays')", true, err);

        assertThat(id.isValid()).isTrue();
        assertThat(err.capacity()).isEqualTo(4096);
        assertThat(api.scidbDisconnect(con.get())).isZero();
    }
}
