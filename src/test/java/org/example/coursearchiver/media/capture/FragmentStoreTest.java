package org.example.coursearchiver.media.capture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FragmentStoreTest {

    @TempDir
    Path tempDir;

    private static CapturedResponse response(String url) {
        return new CapturedResponse(url, url.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void storesEachSegmentOnceInArrivalOrder() throws Exception {
        FragmentStore store = new FragmentStore(tempDir);

        assertTrue(store.add(response("https://cdn.example.com/hls/media_3.ts?token=abc")));
        assertTrue(store.add(response("https://cdn.example.com/hls/media_1.ts?token=abc")));
        assertFalse(store.add(response("https://cdn.example.com/hls/media_3.ts?token=abc")));
        assertFalse(store.add(response("https://cdn.example.com/hls/index.m3u8")));
        assertFalse(store.add(new CapturedResponse("https://cdn.example.com/hls/media_4.ts", null)));

        assertEquals(2, store.size());
        assertEquals(3, store.highestSequence());
        Fragment first = store.fragments().get(0);
        assertEquals(1, first.index());
        assertEquals(3, first.sequence());
        assertEquals("fragment_00001.ts", first.file().getFileName().toString());
        assertArrayEquals("https://cdn.example.com/hls/media_3.ts?token=abc".getBytes(StandardCharsets.UTF_8),
                Files.readAllBytes(first.file()));
    }

    @Test
    void concatListFollowsArrivalOrderAndCount() throws Exception {
        FragmentStore store = new FragmentStore(tempDir);
        store.add(response("https://cdn/seg-10.ts"));
        store.add(response("https://cdn/seg-11.ts"));
        store.add(response("https://cdn/seg-12.ts"));

        Path list = store.writeConcatList(2);

        assertEquals(FragmentStore.CONCAT_LIST, list.getFileName().toString());
        assertEquals(List.of("file 'fragment_00001.ts'", "file 'fragment_00002.ts'"),
                Files.readAllLines(list, StandardCharsets.UTF_8));
    }

    @Test
    void sequenceUsesLastMatchOrFallsBack() {
        assertEquals(12, FragmentStore.parseSequence("https://cdn/seg-7/media_12.ts", 1));
        assertEquals(40, FragmentStore.parseSequence("https://cdn/chunk_40.ts?x=1", 1));
        assertEquals(5, FragmentStore.parseSequence("https://cdn/video.ts", 5));
    }

    @Test
    void onlyTransportStreamUrlsAreFragments() {
        assertTrue(FragmentStore.isFragmentUrl("https://cdn/a/b/MEDIA_1.TS"));
        assertTrue(FragmentStore.isFragmentUrl("https://cdn/a/b/media_1.ts?sig=1"));
        assertFalse(FragmentStore.isFragmentUrl("https://cdn/a/b/media_1.ts.json"));
        assertFalse(FragmentStore.isFragmentUrl("https://cdn/a/b/init.mp4"));
        assertFalse(FragmentStore.isFragmentUrl(null));
    }
}
