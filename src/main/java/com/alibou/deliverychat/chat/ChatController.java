package com.alibou.deliverychat.chat;

import com.alibou.deliverychat.booking.BookingLookup;
import com.alibou.deliverychat.booking.BookingNotFoundException;
import com.alibou.deliverychat.booking.BookingRecord;
import com.alibou.deliverychat.channel.ChatAccessPolicy;
import com.alibou.deliverychat.config.ChatProperties;
import com.alibou.deliverychat.user.Identity;
import com.alibou.deliverychat.user.IdentityResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * История чата по HTTP: для загрузки страницы и для клиентов, которые
 * отстали слишком сильно, чтобы догоняться по сокету.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/bookings/{bookingId}/messages")
public class ChatController {

    private final ChatMessageService chatMessageService;
    private final BookingLookup      bookings;
    private final ChatAccessPolicy   accessPolicy;
    private final IdentityResolver   identityResolver;
    private final ChatProperties     properties;

    /** Старые сверху; без {@code after} отдаётся самая свежая страница. */
    @GetMapping
    public List<ChatFrame> history(@RequestHeader HttpHeaders headers,
                                   @PathVariable long bookingId,
                                   @RequestParam(required = false) Long after,
                                   @RequestParam(required = false) Integer limit) {
        requireReadable(bookingId, headers);
        int pageSize = limit == null ? properties.getReplayLimit() : limit;
        List<ChatMessage> page = after == null
                ? chatMessageService.listRecent(bookingId, pageSize)
                : chatMessageService.listSince(bookingId, after, pageSize);
        return page.stream().map(ChatFrame::of).toList();
    }

    @GetMapping("/unread")
    public Map<String, Long> unread(@RequestHeader HttpHeaders headers, @PathVariable long bookingId) {
        Identity reader = requireReadable(bookingId, headers);
        return Map.of("unread", chatMessageService.countUnread(bookingId, reader.id()));
    }

    @PostMapping("/read")
    public Map<String, Long> markRead(@RequestHeader HttpHeaders headers, @PathVariable long bookingId) {
        Identity reader = requireReadable(bookingId, headers);
        return Map.of("lastReadMessageId", chatMessageService.markRead(bookingId, reader.id()));
    }

    private Identity requireReadable(long bookingId, HttpHeaders headers) {
        Identity identity = identityResolver.require(headers);
        BookingRecord booking = bookings.findRecord(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        accessPolicy.checkRead(booking, identity);
        return identity;
    }
}
