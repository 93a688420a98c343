package com.alibou.deliverychat.channel;

import com.alibou.deliverychat.user.Identity;
import com.alibou.deliverychat.user.IdentityResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/admin/channels")
@RequiredArgsConstructor
public class AdminChannelController {

    private final ChatGateway      gateway;
    private final IdentityResolver identityResolver;

    /** Живые каналы чата и кто в них подключён */
    @GetMapping
    public List<ChannelSnapshot> overview(@RequestHeader HttpHeaders headers) {
        requireAdministrator(headers);
        return gateway.snapshot();
    }

    @GetMapping("/{bookingId}/count")
    public int connectionCount(@RequestHeader HttpHeaders headers, @PathVariable long bookingId) {
        requireAdministrator(headers);
        return gateway.connectionCount(bookingId);
    }

    private void requireAdministrator(HttpHeaders headers) {
        Identity identity = identityResolver.require(headers);
        if (!identity.isAdministrator()) {
            throw new SecurityException("Administrators only");
        }
    }
}
