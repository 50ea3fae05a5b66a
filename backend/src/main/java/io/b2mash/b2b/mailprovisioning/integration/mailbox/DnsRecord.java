package io.b2mash.b2b.mailprovisioning.integration.mailbox;

/** One DNS record a customer must publish. {@code priority} is only set for MX records. */
public record DnsRecord(
    String type, String name, String value, Integer priority, String description) {

  public static DnsRecord mx(String name, String value, int priority, String description) {
    return new DnsRecord("MX", name, value, priority, description);
  }

  public static DnsRecord txt(String name, String value, String description) {
    return new DnsRecord("TXT", name, value, null, description);
  }

  public static DnsRecord cname(String name, String value, String description) {
    return new DnsRecord("CNAME", name, value, null, description);
  }
}
