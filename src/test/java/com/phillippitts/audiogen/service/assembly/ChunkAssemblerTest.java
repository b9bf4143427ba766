package com.phillippitts.audiogen.service.assembly;

import com.phillippitts.audiogen.domain.AudioArtifact;
import com.phillippitts.audiogen.domain.SynthesizedChunk;
import com.phillippitts.audiogen.exception.ArtifactIoException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkAssemblerTest {

    @TempDir
    Path tmp;

    @Test
    void concatenatesInIndexOrderRegardlessOfWriteOrder() throws Exception {
        Path out = tmp.resolve("out/artifact.mp3");
        try (ChunkAssembler assembler = ChunkAssembler.open(tmp.resolve("staging"), "req-1")) {
            assembler.write(2, bytes("C"));
            assembler.write(0, bytes("A"));
            assembler.write(1, bytes("B"));

            AudioArtifact artifact = assembler.assemble(out, 3);

            assertThat(artifact.path()).isEqualTo(out);
            assertThat(artifact.chunkCount()).isEqualTo(3);
            assertThat(artifact.sizeBytes()).isEqualTo(3);
        }
        assertThat(Files.readAllBytes(out)).isEqualTo(bytes("ABC"));
    }

    @Test
    void sortsNumericallyNotLexicographically() throws Exception {
        // With 12 chunks, "10.part" and "11.part" sort before "2.part" as strings
        Path out = tmp.resolve("twelve.pcm");
        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        try (ChunkAssembler assembler = ChunkAssembler.open(tmp, "req-12")) {
            for (int i = 0; i < 12; i++) {
                byte[] data = bytes("[" + i + "]");
                expected.write(data);
                assembler.write(i, data);
            }
            assembler.assemble(out, 12);
        }
        assertThat(new String(Files.readAllBytes(out), StandardCharsets.UTF_8))
                .isEqualTo("[0][1][2][3][4][5][6][7][8][9][10][11]");
        assertThat(Files.readAllBytes(out)).isEqualTo(expected.toByteArray());
    }

    @Test
    void outputIsIdenticalForAnyWritePermutation() throws Exception {
        List<byte[]> original = new ArrayList<>();
        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        Random random = new Random(7);
        for (int i = 0; i < 25; i++) {
            byte[] data = new byte[1 + random.nextInt(64)];
            random.nextBytes(data);
            original.add(data);
            expected.write(data);
        }

        for (int round = 0; round < 5; round++) {
            List<Integer> order = new ArrayList<>();
            for (int i = 0; i < original.size(); i++) {
                order.add(i);
            }
            Collections.shuffle(order, random);

            Path out = tmp.resolve("perm-" + round + ".bin");
            try (ChunkAssembler assembler = ChunkAssembler.open(tmp, "perm")) {
                for (int i : order) {
                    assembler.write(i, original.get(i));
                }
                assembler.assemble(out, original.size());
            }
            assertThat(Files.readAllBytes(out)).isEqualTo(expected.toByteArray());
        }
    }

    @Test
    void assemblesFromSynthesizedChunks() throws Exception {
        Path out = tmp.resolve("list.mp3");
        try (ChunkAssembler assembler = ChunkAssembler.open(tmp, "list")) {
            assembler.assemble(List.of(
                    new SynthesizedChunk(0, bytes("x")),
                    new SynthesizedChunk(1, bytes("yz"))), out);
        }
        assertThat(Files.readAllBytes(out)).isEqualTo(bytes("xyz"));
    }

    @Test
    void missingChunkFailsWithoutWritingArtifact() {
        Path out = tmp.resolve("gap.mp3");
        try (ChunkAssembler assembler = ChunkAssembler.open(tmp, "gap")) {
            assembler.write(0, bytes("A"));
            assembler.write(2, bytes("C"));

            assertThatThrownBy(() -> assembler.assemble(out, 3))
                    .isInstanceOf(ArtifactIoException.class)
                    .hasMessageContaining("Missing staged chunk 1");
        }
        assertThat(out).doesNotExist();
    }

    @Test
    void countMismatchFails() {
        try (ChunkAssembler assembler = ChunkAssembler.open(tmp, "count")) {
            assembler.write(0, bytes("A"));

            assertThatThrownBy(() -> assembler.assemble(tmp.resolve("c.mp3"), 2))
                    .isInstanceOf(ArtifactIoException.class)
                    .hasMessageContaining("Expected 2");
        }
    }

    @Test
    void closeRemovesStagingDirectoryOnSuccessAndFailure() {
        ChunkAssembler ok = ChunkAssembler.open(tmp, "ok");
        ok.write(0, bytes("A"));
        ok.assemble(tmp.resolve("ok.mp3"), 1);
        ok.close();
        assertThat(ok.stagingDir()).doesNotExist();

        ChunkAssembler failed = ChunkAssembler.open(tmp, "failed");
        failed.write(1, bytes("B"));
        assertThatThrownBy(() -> failed.assemble(tmp.resolve("failed.mp3"), 2))
                .isInstanceOf(ArtifactIoException.class);
        failed.close();
        assertThat(failed.stagingDir()).doesNotExist();
    }

    @Test
    void writingSameIndexTwiceFails() {
        try (ChunkAssembler assembler = ChunkAssembler.open(tmp, "dup")) {
            assembler.write(0, bytes("A"));

            assertThatThrownBy(() -> assembler.write(0, bytes("A")))
                    .isInstanceOf(ArtifactIoException.class);
        }
    }

    @Test
    void existingArtifactIsReplacedAtomically() throws Exception {
        Path out = tmp.resolve("same.mp3");
        Files.write(out, bytes("old"));
        try (ChunkAssembler assembler = ChunkAssembler.open(tmp, "replace")) {
            assembler.write(0, bytes("new"));
            assembler.assemble(out, 1);
        }
        assertThat(Files.readAllBytes(out)).isEqualTo(bytes("new"));
        assertThat(tmp.resolve("same.mp3.tmp")).doesNotExist();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
