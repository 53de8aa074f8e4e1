package com.cgraph.auth.crypto.totp;

import static org.assertj.core.api.Assertions.assertThat;

import com.cgraph.auth.crypto.common.RandomProvider;
import java.util.List;
import org.junit.jupiter.api.Test;

class BackupCodesTest {

  private final BackupCodes backupCodes = new BackupCodes(new RandomProvider());

  @Test
  void generate_producesDisplayFormatCodes() {
    List<String> codes = backupCodes.generate(10);
    assertThat(codes).hasSize(10).doesNotHaveDuplicates();
    assertThat(codes).allMatch(code -> code.matches("[A-Z2-7]{4}-[A-Z2-7]{4}"));
  }

  @Test
  void normalize_isCaseAndSeparatorInsensitive() {
    assertThat(BackupCodes.normalize("abcd-efgh")).contains("ABCD-EFGH");
    assertThat(BackupCodes.normalize("ABCDEFGH")).contains("ABCD-EFGH");
    assertThat(BackupCodes.normalize(" ab cd - ef gh ")).contains("ABCD-EFGH");
  }

  @Test
  void normalize_rejectsNonCodes() {
    assertThat(BackupCodes.normalize(null)).isEmpty();
    assertThat(BackupCodes.normalize("ABCD-EFG")).isEmpty();
    assertThat(BackupCodes.normalize("ABCD-EFGHI")).isEmpty();
    assertThat(BackupCodes.normalize("ABCD-EFG1")).isEmpty();
    assertThat(BackupCodes.normalize("123456")).isEmpty();
  }

  @Test
  void hash_sameForEquivalentInput() {
    String a = BackupCodes.hash(BackupCodes.normalize("abcd-efgh").orElseThrow());
    String b = BackupCodes.hash(BackupCodes.normalize("ABCDEFGH").orElseThrow());
    assertThat(a).isEqualTo(b).isNotEqualTo("ABCD-EFGH");
  }

  @Test
  void hashAll_preservesOrder() {
    List<String> codes = backupCodes.generate(3);
    List<String> hashes = BackupCodes.hashAll(codes);
    assertThat(hashes).hasSize(3);
    assertThat(hashes.get(1)).isEqualTo(BackupCodes.hash(codes.get(1)));
  }
}
